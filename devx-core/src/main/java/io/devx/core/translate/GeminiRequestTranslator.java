package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.TextPart;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolResultPart;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.Turn;
import io.devx.core.repair.ConversationRepairer;
import io.devx.core.schema.SchemaCache;
import java.util.List;

/**
 * Gemini {@code generateContent} bodies. The model goes in the URL, so the body carries none. Function
 * responses need the function name, which is looked up from the call that issued the id.
 */
public final class GeminiRequestTranslator extends AbstractRequestTranslator {

    public GeminiRequestTranslator(String backend, SchemaCache schemaCache, ConversationRepairer repairer) {
        super(backend, schemaCache, repairer);
    }

    @Override
    public Dialect dialect() {
        return Dialect.GEMINI;
    }

    @Override
    protected ObjectNode buildBody(Prepared prepared, GenerationOptions options) {
        ObjectNode body = mapper.createObjectNode();
        if (!prepared.systemInstruction().isBlank()) {
            body.putObject("systemInstruction")
                .putArray("parts")
                .addObject()
                .put("text", prepared.systemInstruction());
        }

        ArrayNode contents = body.putArray("contents");
        for (Turn turn : prepared.turns()) {
            ObjectNode content = contents.addObject();
            content.put("role", turn.role() == Role.ASSISTANT ? "model" : "user");
            ArrayNode parts = content.putArray("parts");
            for (Part part : turn.parts()) {
                appendPart(parts, part, prepared);
            }
        }

        if (prepared.hasTools()) {
            body.set("tools", prepared.tools());
        }

        ObjectNode generation = body.putObject("generationConfig");
        generation.put("maxOutputTokens", options.maxOutputTokens());
        putSampling(generation, options, "topP", "topK");
        return body;
    }

    @Override
    protected JsonNode translateTools(List<ToolSchema> tools) {
        ArrayNode wrapper = mapper.createArrayNode();
        ArrayNode declarations = wrapper.addObject().putArray("functionDeclarations");
        JsonNode translated = super.translateTools(tools);
        translated.forEach(declarations::add);
        return wrapper;
    }

    @Override
    protected void translateTool(ToolSchema tool, ObjectNode normalizedParameters, ArrayNode target) {
        ObjectNode row = target.addObject();
        row.put("name", tool.name());
        row.put("description", tool.description());
        row.set("parameters", normalizedParameters);
    }

    private void appendPart(ArrayNode parts, Part part, Prepared prepared) {
        if (part instanceof TextPart text) {
            parts.addObject().put("text", text.content());
        } else if (part instanceof ToolCallPart call) {
            ObjectNode functionCall = parts.addObject().putObject("functionCall");
            functionCall.put("id", call.id());
            functionCall.put("name", call.name());
            functionCall.set("args", call.arguments());
        } else if (part instanceof ToolResultPart result) {
            ObjectNode functionResponse = parts.addObject().putObject("functionResponse");
            functionResponse.put("id", result.toolCallId());
            functionResponse.put("name", prepared.toolNameFor(result));
            JsonNode payload = result.payload();
            if (payload.isObject()) {
                functionResponse.set("response", payload);
            } else {
                functionResponse.putObject("response").set("output", payload);
            }
        }
    }
}
