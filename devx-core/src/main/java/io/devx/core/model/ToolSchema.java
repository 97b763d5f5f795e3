package io.devx.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.schema.CanonicalJson;
import java.util.Objects;

/**
 * Abstract tool description. Identity for caching is the hash of the canonical document, see
 * {@link #fingerprint()}.
 */
public record ToolSchema(String name, String description, JsonNode parameters) {

    public ToolSchema {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("tool name must not be blank");
        }
        description = description == null ? "" : description;
        parameters = parameters == null || parameters.isNull() || parameters.isMissingNode()
            ? JsonNodeFactory.instance.objectNode()
            : parameters.deepCopy();
    }

    public ObjectNode toDocument() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.put("name", name);
        document.put("description", description);
        document.set("parameters", parameters.deepCopy());
        return document;
    }

    public String fingerprint() {
        return CanonicalJson.sha256(toDocument());
    }
}
