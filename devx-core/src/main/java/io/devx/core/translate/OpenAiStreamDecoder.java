package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.model.FinishReason;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.StreamEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes Chat Completions chunks. Tool call fragments are keyed by their {@code index}; the id only
 * arrives on the first fragment, so later fragments are resolved through the index. A chunk carrying
 * {@code finish_reason} closes every open call.
 */
public final class OpenAiStreamDecoder implements StreamDecoder {
    private final Map<Integer, String> toolIdsByIndex = new TreeMap<>();
    private FinishReason finishReason;
    private UsageMetadata usage = UsageMetadata.ZERO;
    private boolean ended;

    @Override
    public List<StreamEvent> decode(JsonNode chunk) {
        List<StreamEvent> events = new ArrayList<>();
        if (chunk.path("usage").isObject()) {
            usage = OpenAiResponseTranslator.usage(chunk.path("usage"));
        }
        for (JsonNode choice : chunk.path("choices")) {
            JsonNode delta = choice.path("delta");
            JsonNode content = delta.path("content");
            if (content.isTextual() && !content.asText().isEmpty()) {
                events.add(new StreamEvent.TextDelta(content.asText()));
            }
            for (JsonNode toolCall : delta.path("tool_calls")) {
                collectToolCall(toolCall, events);
            }
            JsonNode reason = choice.path("finish_reason");
            if (reason.isTextual()) {
                finishReason = OpenAiResponseTranslator.finishReason(reason.asText());
                for (String id : toolIdsByIndex.values()) {
                    events.add(new StreamEvent.ToolCallEnd(id));
                }
                toolIdsByIndex.clear();
            }
        }
        return events;
    }

    @Override
    public List<StreamEvent> finish() {
        if (ended) {
            return List.of();
        }
        ended = true;
        return List.of(new StreamEvent.MessageEnd(finishReason == null ? FinishReason.OTHER : finishReason, usage));
    }

    private void collectToolCall(JsonNode toolCall, List<StreamEvent> events) {
        int index = Math.max(toolCall.path("index").asInt(0), 0);
        String id = toolIdsByIndex.get(index);
        if (id == null) {
            id = ToolCallIds.orSynthesize(toolCall.path("id").asText(""));
            toolIdsByIndex.put(index, id);
            events.add(new StreamEvent.ToolCallStart(id, toolCall.path("function").path("name").asText("")));
        }
        String fragment = toolCall.path("function").path("arguments").asText("");
        if (!fragment.isEmpty()) {
            events.add(new StreamEvent.ToolCallArgumentDelta(id, fragment));
        }
    }
}
