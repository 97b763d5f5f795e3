package io.devx.core.translate;

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
 * OpenAI Chat Completions bodies. Tool results leave their user turn as separate {@code role: tool}
 * messages, emitted ahead of any text in that turn.
 */
public final class OpenAiRequestTranslator extends AbstractRequestTranslator {

    public OpenAiRequestTranslator(String backend, SchemaCache schemaCache, ConversationRepairer repairer) {
        super(backend, schemaCache, repairer);
    }

    @Override
    public Dialect dialect() {
        return Dialect.OPENAI_CHAT;
    }

    @Override
    protected ObjectNode buildBody(Prepared prepared, GenerationOptions options) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", options.model());
        body.put("max_tokens", options.maxOutputTokens());

        ArrayNode messages = body.putArray("messages");
        if (!prepared.systemInstruction().isBlank()) {
            ObjectNode system = messages.addObject();
            system.put("role", "system");
            system.put("content", prepared.systemInstruction());
        }
        for (Turn turn : prepared.turns()) {
            if (turn.role() == Role.ASSISTANT) {
                appendAssistant(messages, turn);
            } else {
                appendUser(messages, turn);
            }
        }

        if (prepared.hasTools()) {
            body.set("tools", prepared.tools());
            body.put("tool_choice", "auto");
        }
        putSampling(body, options, "top_p", null);
        return body;
    }

    @Override
    protected void translateTool(ToolSchema tool, ObjectNode normalizedParameters, ArrayNode target) {
        ObjectNode row = target.addObject();
        row.put("type", "function");
        ObjectNode function = row.putObject("function");
        function.put("name", tool.name());
        function.put("description", tool.description());
        function.set("parameters", normalizedParameters);
    }

    private void appendAssistant(ArrayNode messages, Turn turn) {
        ObjectNode message = messages.addObject();
        message.put("role", "assistant");
        List<ToolCallPart> calls = turn.toolCalls();
        String text = textOf(turn.parts());
        if (text.isEmpty() && !calls.isEmpty()) {
            message.putNull("content");
        } else {
            message.put("content", text);
        }
        if (calls.isEmpty()) {
            return;
        }
        ArrayNode toolCalls = message.putArray("tool_calls");
        for (ToolCallPart call : calls) {
            ObjectNode item = toolCalls.addObject();
            item.put("id", call.id());
            item.put("type", "function");
            ObjectNode function = item.putObject("function");
            function.put("name", call.name());
            function.put("arguments", call.arguments().toString());
        }
    }

    private void appendUser(ArrayNode messages, Turn turn) {
        for (ToolResultPart result : turn.toolResults()) {
            ObjectNode message = messages.addObject();
            message.put("role", "tool");
            message.put("tool_call_id", result.toolCallId());
            message.put("content", result.payloadAsText());
        }

        List<Part> textParts = turn.parts().stream().filter(TextPart.class::isInstance).toList();
        if (textParts.isEmpty()) {
            return;
        }
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        if (isSingleText(textParts)) {
            message.put("content", textOf(textParts));
            return;
        }
        ArrayNode content = message.putArray("content");
        for (Part part : textParts) {
            ObjectNode block = content.addObject();
            block.put("type", "text");
            block.put("text", ((TextPart) part).content());
        }
    }
}
