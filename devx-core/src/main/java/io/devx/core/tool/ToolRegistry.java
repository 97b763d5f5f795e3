package io.devx.core.tool;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolResultPart;
import io.devx.core.model.ToolSchema;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registered tools, exposed to providers as {@link ToolSchema}s and executed for {@link ToolCallPart}s.
 * A failing or unknown tool yields an error result rather than an exception, so the model can react.
 */
public final class ToolRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRegistry.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public List<ToolSchema> schemas() {
        return tools.values().stream()
            .sorted(Comparator.comparing(Tool::name))
            .map(tool -> new ToolSchema(tool.name(), tool.description(), mapper.valueToTree(tool.schema())))
            .toList();
    }

    public ToolResultPart execute(ToolCallPart call, ToolContext context) {
        Optional<Tool> tool = find(call.name());
        if (tool.isEmpty()) {
            return ToolResultPart.ofText(call.id(), "Error: Tool '" + call.name() + "' not found");
        }
        try {
            Map<String, Object> input = mapper.convertValue(arguments(call.arguments()), MAP_TYPE);
            return ToolResultPart.ofText(call.id(), tool.get().execute(input, context));
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", call.name(), ex);
            return ToolResultPart.ofText(call.id(), "Error executing tool '" + call.name() + "': " + ex.getMessage());
        }
    }

    private JsonNode arguments(JsonNode arguments) {
        return arguments.isObject() ? arguments : mapper.createObjectNode();
    }
}
