package io.devx.core.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * A named rewrite applied to a tool's parameter schema when {@code appliesTo} matches its shape.
 * Transforms mutate the (already copied) schema in place.
 */
public record NormalizationRule(String name, Predicate<ObjectNode> appliesTo, Consumer<ObjectNode> transform) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(appliesTo, "appliesTo must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
    }

    public boolean apply(ObjectNode schema) {
        if (!appliesTo.test(schema)) {
            return false;
        }
        transform.accept(schema);
        return true;
    }
}
