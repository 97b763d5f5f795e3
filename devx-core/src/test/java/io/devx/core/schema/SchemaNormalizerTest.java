package io.devx.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.translate.Dialect;
import org.junit.jupiter.api.Test;

class SchemaNormalizerTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldFillObjectRootAndRequiredForAnthropic() {
        ObjectNode normalized = SchemaNormalizer.forDialect(Dialect.ANTHROPIC_MESSAGES).normalize(mapper.createObjectNode());

        assertThat(normalized.path("type").asText()).isEqualTo("object");
        assertThat(normalized.path("properties").isObject()).isTrue();
        assertThat(normalized.path("required").isArray()).isTrue();
    }

    @Test
    void shouldNotAddRequiredForOpenAiButFixScalarRequired() throws Exception {
        SchemaNormalizer normalizer = SchemaNormalizer.forDialect(Dialect.OPENAI_CHAT);

        assertThat(normalizer.normalize(mapper.createObjectNode()).has("required")).isFalse();
        ObjectNode fixed = normalizer.normalize(mapper.readTree("{\"type\":\"object\",\"required\":\"path\"}"));
        assertThat(fixed.path("required").isArray()).isTrue();
        assertThat(fixed.path("required").get(0).asText()).isEqualTo("path");
    }

    @Test
    void shouldStripUnsupportedKeywordsForGeminiButKeepPropertyNames() throws Exception {
        JsonNode input = mapper.readTree("""
            {
              "$schema": "http://json-schema.org/draft-07/schema#",
              "type": "object",
              "additionalProperties": false,
              "properties": {
                "additionalProperties": { "type": "string" },
                "options": { "type": "object", "additionalProperties": true, "properties": {} },
                "limit": { "type": ["integer", "null"] }
              }
            }
            """);

        ObjectNode normalized = SchemaNormalizer.forDialect(Dialect.GEMINI).normalize(input);

        assertThat(normalized.has("$schema")).isFalse();
        assertThat(normalized.has("additionalProperties")).isFalse();
        assertThat(normalized.path("properties").has("additionalProperties")).isTrue();
        assertThat(normalized.path("properties").path("options").has("additionalProperties")).isFalse();
        assertThat(normalized.path("properties").path("limit").path("type").asText()).isEqualTo("integer");
        assertThat(normalized.path("properties").path("limit").path("nullable").asBoolean()).isTrue();
    }

    @Test
    void shouldLeaveInputUntouched() throws Exception {
        JsonNode input = mapper.readTree("{\"$schema\":\"x\"}");

        SchemaNormalizer.forDialect(Dialect.GEMINI).normalize(input);

        assertThat(input.has("$schema")).isTrue();
        assertThat(input.has("type")).isFalse();
    }

    @Test
    void shouldReportWhetherRuleApplied() {
        NormalizationRule rule = SchemaNormalizer.objectRoot();

        assertThat(rule.apply(mapper.createObjectNode())).isTrue();
        assertThat(rule.apply((ObjectNode) mapper.createObjectNode().put("type", "object"))).isFalse();
    }
}
