package io.devx.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.translate.Dialect;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Rewrites tool parameter schemas into the subset each backend accepts. Rules are matched on schema shape,
 * never on tool name, and applied in declaration order.
 */
public final class SchemaNormalizer {
    private static final Set<String> GEMINI_UNSUPPORTED = Set.of("$schema", "$id", "additionalProperties");

    private final List<NormalizationRule> rules;

    public SchemaNormalizer(List<NormalizationRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static SchemaNormalizer forDialect(Dialect dialect) {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.add(objectRoot());
        rules.add(propertiesPresent());
        switch (dialect) {
            case ANTHROPIC_MESSAGES -> rules.add(requiredArray(true));
            case OPENAI_CHAT -> rules.add(requiredArray(false));
            case GEMINI -> {
                rules.add(requiredArray(false));
                rules.add(stripUnsupportedKeywords());
                rules.add(nullableTypeUnion());
            }
        }
        return new SchemaNormalizer(rules);
    }

    public List<NormalizationRule> rules() {
        return rules;
    }

    public ObjectNode normalize(JsonNode parameters) {
        ObjectNode schema = parameters != null && parameters.isObject()
            ? ((ObjectNode) parameters).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        for (NormalizationRule rule : rules) {
            rule.apply(schema);
        }
        return schema;
    }

    static NormalizationRule objectRoot() {
        return new NormalizationRule(
            "object-root",
            schema -> !"object".equals(schema.path("type").asText("")),
            schema -> schema.put("type", "object")
        );
    }

    static NormalizationRule propertiesPresent() {
        return new NormalizationRule(
            "properties-present",
            schema -> !schema.path("properties").isObject(),
            schema -> schema.set("properties", JsonNodeFactory.instance.objectNode())
        );
    }

    static NormalizationRule requiredArray(boolean fillMissing) {
        return new NormalizationRule(
            "required-array",
            schema -> schema.has("required") ? !schema.get("required").isArray() : fillMissing,
            schema -> {
                ArrayNode required = JsonNodeFactory.instance.arrayNode();
                JsonNode current = schema.path("required");
                if (current.isTextual() && !current.asText().isBlank()) {
                    required.add(current.asText());
                }
                schema.set("required", required);
            }
        );
    }

    static NormalizationRule stripUnsupportedKeywords() {
        return new NormalizationRule(
            "strip-unsupported-keywords",
            schema -> anySchema(schema, node -> GEMINI_UNSUPPORTED.stream().anyMatch(node::has)),
            schema -> forEachSchema(schema, node -> node.remove(GEMINI_UNSUPPORTED))
        );
    }

    static NormalizationRule nullableTypeUnion() {
        return new NormalizationRule(
            "nullable-type-union",
            schema -> anySchema(schema, SchemaNormalizer::isNullableUnion),
            schema -> forEachSchema(schema, node -> {
                if (!isNullableUnion(node)) {
                    return;
                }
                String concrete = "string";
                for (JsonNode type : node.get("type")) {
                    if (!"null".equals(type.asText())) {
                        concrete = type.asText();
                    }
                }
                node.put("type", concrete);
                node.put("nullable", true);
            })
        );
    }

    private static boolean isNullableUnion(ObjectNode node) {
        JsonNode type = node.get("type");
        if (type == null || !type.isArray() || type.size() != 2) {
            return false;
        }
        return "null".equals(type.get(0).asText()) || "null".equals(type.get(1).asText());
    }

    private static boolean anySchema(ObjectNode root, Predicate<ObjectNode> test) {
        boolean[] found = {false};
        forEachSchema(root, node -> found[0] = found[0] || test.test(node));
        return found[0];
    }

    // "properties" holds a name -> schema map, so its own keys are never treated as keywords.
    private static void forEachSchema(ObjectNode schema, Consumer<ObjectNode> visitor) {
        visitor.accept(schema);
        List<Map.Entry<String, JsonNode>> snapshot = new ArrayList<>();
        schema.fields().forEachRemaining(snapshot::add);
        for (Map.Entry<String, JsonNode> field : snapshot) {
            JsonNode value = field.getValue();
            if ("properties".equals(field.getKey()) && value.isObject()) {
                value.forEach(child -> {
                    if (child.isObject()) {
                        forEachSchema((ObjectNode) child, visitor);
                    }
                });
            } else if (value.isObject()) {
                forEachSchema((ObjectNode) value, visitor);
            } else if (value.isArray()) {
                value.forEach(child -> {
                    if (child.isObject()) {
                        forEachSchema((ObjectNode) child, visitor);
                    }
                });
            }
        }
    }
}
