package io.devx.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

public record ToolResultPart(String toolCallId, JsonNode payload) implements Part {

    public ToolResultPart {
        payload = payload == null || payload.isMissingNode()
            ? JsonNodeFactory.instance.nullNode()
            : payload.deepCopy();
    }

    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public static ToolResultPart ofText(String toolCallId, String output) {
        return new ToolResultPart(toolCallId, TextNode.valueOf(output == null ? "" : output));
    }

    /**
     * Payload rendered as a string: text payloads as-is, anything else as compact JSON.
     */
    public String payloadAsText() {
        if (payload.isTextual()) {
            return payload.asText();
        }
        if (payload.isNull()) {
            return "";
        }
        return payload.toString();
    }
}
