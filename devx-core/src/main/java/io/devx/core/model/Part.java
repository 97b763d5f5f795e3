package io.devx.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Atomic content unit of a {@link Turn}: {@link TextPart}, {@link ToolCallPart} or {@link ToolResultPart}.
 */
public interface Part {

    static TextPart text(String content) {
        return new TextPart(content);
    }

    static ToolCallPart toolCall(String id, String name, JsonNode arguments) {
        return new ToolCallPart(id, name, arguments);
    }

    static ToolResultPart toolResult(String toolCallId, JsonNode payload) {
        return new ToolResultPart(toolCallId, payload);
    }
}
