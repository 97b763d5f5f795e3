package io.devx.core.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import io.devx.core.stream.DataQualityWarning;
import java.util.ArrayList;
import java.util.List;

public final class OpenAiResponseTranslator implements ResponseTranslator {
    private final String backend;
    private final ObjectMapper mapper = new ObjectMapper();

    public OpenAiResponseTranslator(String backend) {
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
        JsonNode choice = root.path("choices").path(0);
        if (!choice.isObject()) {
            throw new UpstreamProtocolException(backend, Stage.REQUEST, "response has no choices");
        }

        JsonNode message = choice.path("message");
        List<Part> parts = new ArrayList<>();
        List<DataQualityWarning> warnings = new ArrayList<>();
        String text = contentText(message.path("content"));
        if (!text.isEmpty()) {
            parts.add(new TextPart(text));
        }

        for (JsonNode item : message.path("tool_calls")) {
            String id = ToolCallIds.orSynthesize(item.path("id").asText(""));
            JsonNode function = item.path("function");
            String name = function.path("name").asText("");
            parts.add(new ToolCallPart(id, name, arguments(function.path("arguments"), id, name, warnings)));
        }

        return new ModelResponse(
            new Turn(Role.ASSISTANT, parts),
            finishReason(choice.path("finish_reason").asText(null)),
            usage(root.path("usage")),
            warnings
        );
    }

    static FinishReason finishReason(String reason) {
        if (reason == null) {
            return FinishReason.OTHER;
        }
        return switch (reason) {
            case "stop", "tool_calls", "function_call" -> FinishReason.STOP;
            case "length" -> FinishReason.MAX_OUTPUT_REACHED;
            case "content_filter" -> FinishReason.CONTENT_FILTERED;
            default -> FinishReason.OTHER;
        };
    }

    static UsageMetadata usage(JsonNode usage) {
        return new UsageMetadata(usage.path("prompt_tokens").asInt(0), usage.path("completion_tokens").asInt(0));
    }

    private static String contentText(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        StringBuilder text = new StringBuilder();
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText(""))) {
                    text.append(block.path("text").asText(""));
                }
            }
        }
        return text.toString();
    }

    private JsonNode arguments(JsonNode raw, String id, String name, List<DataQualityWarning> warnings) {
        if (raw.isContainerNode()) {
            return raw;
        }
        String text = raw.asText("");
        if (text.isBlank()) {
            warnings.add(new DataQualityWarning(backend, id, name, DataQualityWarning.Kind.EMPTY_ARGUMENTS, "no arguments"));
            return mapper.createObjectNode();
        }
        try {
            JsonNode parsed = mapper.readTree(text);
            if (parsed != null && !parsed.isMissingNode()) {
                return parsed;
            }
            warnings.add(unparsable(id, name, "arguments are not valid JSON"));
        } catch (JsonProcessingException e) {
            warnings.add(unparsable(id, name, e.getOriginalMessage()));
        }
        return mapper.createObjectNode();
    }

    private DataQualityWarning unparsable(String id, String name, String detail) {
        return new DataQualityWarning(backend, id, name, DataQualityWarning.Kind.UNPARSABLE_ARGUMENTS, detail);
    }
}
