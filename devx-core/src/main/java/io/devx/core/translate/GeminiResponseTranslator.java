package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.error.Stage;
import io.devx.core.error.UpstreamProtocolException;
import io.devx.core.model.FinishReason;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.TextPart;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.Turn;
import io.devx.core.model.UsageMetadata;
import java.util.ArrayList;
import java.util.List;

/**
 * Gemini responses. Function calls that arrive without an id get a generated {@code call_} id that is unique
 * across the conversation.
 */
public final class GeminiResponseTranslator implements ResponseTranslator {
    private final String backend;

    public GeminiResponseTranslator(String backend) {
        this.backend = backend;
    }

    @Override
    public ModelResponse translate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, "response is not a JSON object");
        }
        if (root.has("error")) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, root.path("error").path("message").asText("error response"));
        }
        JsonNode candidate = root.path("candidates").path(0);
        if (!candidate.isObject()) {
            if (root.path("promptFeedback").has("blockReason")) {
                return new ModelResponse(Turn.filler(), FinishReason.CONTENT_FILTERED, usage(root.path("usageMetadata")));
            }
            throw new UpstreamProtocolException(backend, Stage.REQUEST, "response has no candidates");
        }

        List<Part> parts = new ArrayList<>();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                String id = ToolCallIds.orSynthesize(call.path("id").asText(""));
                parts.add(new ToolCallPart(id, call.path("name").asText(""), call.path("args")));
            } else if (part.has("text") && !part.path("thought").asBoolean(false)) {
                String text = part.path("text").asText("");
                if (!text.isEmpty()) {
                    parts.add(new TextPart(text));
                }
            }
        }

        return new ModelResponse(
            new Turn(Role.ASSISTANT, parts),
            finishReason(candidate.path("finishReason").asText(null)),
            usage(root.path("usageMetadata"))
        );
    }

    static FinishReason finishReason(String reason) {
        if (reason == null) {
            return FinishReason.OTHER;
        }
        return switch (reason) {
            case "STOP" -> FinishReason.STOP;
            case "MAX_TOKENS" -> FinishReason.MAX_OUTPUT_REACHED;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII" -> FinishReason.CONTENT_FILTERED;
            default -> FinishReason.OTHER;
        };
    }

    static UsageMetadata usage(JsonNode usage) {
        return new UsageMetadata(usage.path("promptTokenCount").asInt(0), usage.path("candidatesTokenCount").asInt(0));
    }
}
