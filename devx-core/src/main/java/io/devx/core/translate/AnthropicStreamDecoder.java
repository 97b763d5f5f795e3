package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.error.Stage;
import io.devx.core.error.TransientNetworkException;
import io.devx.core.error.UpstreamProtocolException;
import io.devx.core.model.FinishReason;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.StreamEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes Anthropic Messages stream events, as sent over SSE or wrapped in Bedrock response chunks.
 * Tool blocks are tracked by content block index.
 */
public final class AnthropicStreamDecoder implements StreamDecoder {
    private final String backend;
    private final Map<Integer, String> toolIdsByIndex = new HashMap<>();
    private int promptUnits;
    private int completionUnits;
    private FinishReason finishReason;
    private boolean ended;

    public AnthropicStreamDecoder(String backend) {
        this.backend = backend;
    }

    @Override
    public List<StreamEvent> decode(JsonNode chunk) {
        List<StreamEvent> events = new ArrayList<>();
        String type = chunk.path("type").asText("");
        switch (type) {
            case "message_start" -> promptUnits = chunk.path("message").path("usage").path("input_tokens").asInt(promptUnits);
            case "content_block_start" -> {
                int index = chunk.path("index").asInt(-1);
                JsonNode block = chunk.path("content_block");
                String blockType = block.path("type").asText("");
                if ("tool_use".equals(blockType)) {
                    String id = block.path("id").asText("");
                    toolIdsByIndex.put(index, id);
                    events.add(new StreamEvent.ToolCallStart(id, block.path("name").asText("")));
                } else if ("text".equals(blockType) && !block.path("text").asText("").isEmpty()) {
                    events.add(new StreamEvent.TextDelta(block.path("text").asText("")));
                }
            }
            case "content_block_delta" -> {
                int index = chunk.path("index").asInt(-1);
                JsonNode delta = chunk.path("delta");
                if (delta.has("text")) {
                    events.add(new StreamEvent.TextDelta(delta.path("text").asText("")));
                } else if (toolIdsByIndex.containsKey(index)) {
                    String fragment = delta.has("partial_json")
                        ? delta.path("partial_json").asText("")
                        : delta.has("input") ? delta.get("input").toString() : "";
                    events.add(new StreamEvent.ToolCallArgumentDelta(toolIdsByIndex.get(index), fragment));
                }
            }
            case "content_block_stop" -> {
                String id = toolIdsByIndex.remove(chunk.path("index").asInt(-1));
                if (id != null) {
                    events.add(new StreamEvent.ToolCallEnd(id));
                }
            }
            case "message_delta" -> {
                JsonNode stopReason = chunk.path("delta").path("stop_reason");
                if (stopReason.isTextual()) {
                    finishReason = AnthropicResponseTranslator.finishReason(stopReason.asText());
                }
                completionUnits = chunk.path("usage").path("output_tokens").asInt(completionUnits);
            }
            case "message_stop" -> {
                JsonNode metrics = chunk.path("amazon-bedrock-invocationMetrics");
                if (metrics.isObject()) {
                    promptUnits = metrics.path("inputTokenCount").asInt(promptUnits);
                    completionUnits = metrics.path("outputTokenCount").asInt(completionUnits);
                }
                events.add(messageEnd());
            }
            case "error" -> throw streamError(chunk.path("error"));
            default -> {
            }
        }
        return events;
    }

    @Override
    public List<StreamEvent> finish() {
        return ended ? List.of() : List.of(messageEnd());
    }

    private StreamEvent messageEnd() {
        ended = true;
        return new StreamEvent.MessageEnd(
            finishReason == null ? FinishReason.OTHER : finishReason,
            new UsageMetadata(promptUnits, completionUnits)
        );
    }

    private RuntimeException streamError(JsonNode error) {
        String errorType = error.path("type").asText("");
        String message = errorType + ": " + error.path("message").asText("stream error");
        if ("overloaded_error".equals(errorType) || "api_error".equals(errorType)) {
            return new TransientNetworkException(backend, Stage.STREAM, message, null);
        }
        return new UpstreamProtocolException(backend, Stage.STREAM, message);
    }
}
