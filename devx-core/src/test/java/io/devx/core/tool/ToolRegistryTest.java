package io.devx.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolResultPart;
import io.devx.core.model.ToolSchema;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldExposeSortedSchemas() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new FixedTool("zeta", "z"));
        registry.register(new FixedTool("alpha", "a"));

        assertThat(registry.schemas()).extracting(ToolSchema::name).containsExactly("alpha", "zeta");
        assertThat(registry.schemas().get(0).parameters().path("type").asText()).isEqualTo("object");
    }

    @Test
    void shouldExecuteCallAndKeepItsId() throws Exception {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new FixedTool("echo", "unused"));

        ToolResultPart result = registry.execute(
            new ToolCallPart("t1", "echo", mapper.readTree("{\"text\":\"ping\"}")),
            new ToolContext(Path.of("."))
        );

        assertThat(result.toolCallId()).isEqualTo("t1");
        assertThat(result.payloadAsText()).isEqualTo("ping");
    }

    @Test
    void shouldReturnErrorResultForUnknownOrFailingTool() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new Tool() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public String description() {
                return "always fails";
            }

            @Override
            public Map<String, Object> schema() {
                return Map.of("type", "object");
            }

            @Override
            public String execute(Map<String, Object> input, ToolContext context) {
                throw new IllegalStateException("disk on fire");
            }
        });

        ToolResultPart missing = registry.execute(new ToolCallPart("t1", "nope", null), new ToolContext(Path.of(".")));
        ToolResultPart failed = registry.execute(new ToolCallPart("t2", "broken", null), new ToolContext(Path.of(".")));

        assertThat(missing.payloadAsText()).contains("not found");
        assertThat(failed.toolCallId()).isEqualTo("t2");
        assertThat(failed.payloadAsText()).contains("disk on fire");
    }

    private static final class FixedTool implements Tool {
        private final String name;
        private final String fallback;

        private FixedTool(String name, String fallback) {
            this.name = name;
            this.fallback = fallback;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String description() {
            return "Returns its text argument";
        }

        @Override
        public Map<String, Object> schema() {
            return Map.of("type", "object", "properties", Map.of("text", Map.of("type", "string")));
        }

        @Override
        public String execute(Map<String, Object> input, ToolContext context) {
            return String.valueOf(input.getOrDefault("text", fallback));
        }
    }
}
