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

public final class AnthropicResponseTranslator implements ResponseTranslator {
    private final String backend;

    public AnthropicResponseTranslator(String backend) {
        this.backend = backend;
    }

    @Override
    public ModelResponse translate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, "response is not a JSON object");
        }
        if ("error".equals(root.path("type").asText(""))) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, root.path("error").path("message").asText("error response"));
        }
        JsonNode content = root.path("content");
        if (!content.isArray()) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, "response has no content array");
        }

        List<Part> parts = new ArrayList<>();
        for (JsonNode item : content) {
            String type = item.path("type").asText("");
            if ("text".equals(type)) {
                String text = item.path("text").asText("");
                if (!text.isEmpty()) {
                    parts.add(new TextPart(text));
                }
            } else if ("tool_use".equals(type)) {
                parts.add(new ToolCallPart(item.path("id").asText(""), item.path("name").asText(""), item.path("input")));
            }
        }

        return new ModelResponse(
            new Turn(Role.ASSISTANT, parts),
            finishReason(root.path("stop_reason").asText(null)),
            usage(root.path("usage"))
        );
    }

    static FinishReason finishReason(String stopReason) {
        if (stopReason == null) {
            return FinishReason.OTHER;
        }
        return switch (stopReason) {
            case "end_turn", "stop_sequence", "tool_use" -> FinishReason.STOP;
            case "max_tokens" -> FinishReason.MAX_OUTPUT_REACHED;
            case "content_filtered", "refusal" -> FinishReason.CONTENT_FILTERED;
            default -> FinishReason.OTHER;
        };
    }

    static UsageMetadata usage(JsonNode usage) {
        return new UsageMetadata(usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0));
    }
}
