package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import io.devx.core.model.FinishReason;
import io.devx.core.model.UsageMetadata;
import io.devx.core.stream.StreamEvent;
import java.util.ArrayList;
import java.util.List;

/**
 * Gemini streams whole function calls, so every call becomes a start, a single argument fragment and an end.
 */
public final class GeminiStreamDecoder implements StreamDecoder {
    private FinishReason finishReason;
    private UsageMetadata usage = UsageMetadata.ZERO;
    private boolean ended;

    @Override
    public List<StreamEvent> decode(JsonNode chunk) {
        List<StreamEvent> events = new ArrayList<>();
        if (chunk.path("usageMetadata").isObject()) {
            usage = GeminiResponseTranslator.usage(chunk.path("usageMetadata"));
        }
        JsonNode candidate = chunk.path("candidates").path(0);
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.has("functionCall")) {
                JsonNode call = part.get("functionCall");
                String id = ToolCallIds.orSynthesize(call.path("id").asText(""));
                events.add(new StreamEvent.ToolCallStart(id, call.path("name").asText("")));
                JsonNode args = call.path("args");
                if (args.isObject()) {
                    events.add(new StreamEvent.ToolCallArgumentDelta(id, args.toString()));
                }
                events.add(new StreamEvent.ToolCallEnd(id));
            } else if (part.has("text") && !part.path("thought").asBoolean(false)) {
                String text = part.path("text").asText("");
                if (!text.isEmpty()) {
                    events.add(new StreamEvent.TextDelta(text));
                }
            }
        }
        if (candidate.path("finishReason").isTextual()) {
            finishReason = GeminiResponseTranslator.finishReason(candidate.path("finishReason").asText());
        } else if (chunk.path("promptFeedback").has("blockReason")) {
            finishReason = FinishReason.CONTENT_FILTERED;
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
}
