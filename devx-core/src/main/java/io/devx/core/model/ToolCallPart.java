package io.devx.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A tool invocation requested by the assistant. The id is carried verbatim to and from every backend;
 * it may be null only on input that has not been through the repairer, and translation rejects it.
 */
public record ToolCallPart(String id, String name, JsonNode arguments) implements Part {

    public ToolCallPart {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null || arguments.isNull() || arguments.isMissingNode()
            ? JsonNodeFactory.instance.objectNode()
            : arguments.deepCopy();
    }

    @Override
    public JsonNode arguments() {
        return arguments.deepCopy();
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
