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

/**
 * Anthropic Messages bodies. The Bedrock variant carries {@code anthropic_version} instead of a model field,
 * since Bedrock takes the model id on the invocation itself.
 */
public final class AnthropicRequestTranslator extends AbstractRequestTranslator {
    public static final String BEDROCK_ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private final boolean bedrock;

    public AnthropicRequestTranslator(String backend, SchemaCache schemaCache, ConversationRepairer repairer) {
        this(backend, schemaCache, repairer, false);
    }

    public AnthropicRequestTranslator(String backend, SchemaCache schemaCache, ConversationRepairer repairer, boolean bedrock) {
        super(backend, schemaCache, repairer);
        this.bedrock = bedrock;
    }

    @Override
    public Dialect dialect() {
        return Dialect.ANTHROPIC_MESSAGES;
    }

    @Override
    protected ObjectNode buildBody(Prepared prepared, GenerationOptions options) {
        ObjectNode body = mapper.createObjectNode();
        if (bedrock) {
            body.put("anthropic_version", BEDROCK_ANTHROPIC_VERSION);
        } else {
            body.put("model", options.model());
        }
        body.put("max_tokens", options.maxOutputTokens());
        if (!prepared.systemInstruction().isBlank()) {
            body.put("system", prepared.systemInstruction());
        }

        ArrayNode messages = body.putArray("messages");
        for (Turn turn : prepared.turns()) {
            ObjectNode message = messages.addObject();
            message.put("role", turn.role() == Role.ASSISTANT ? "assistant" : "user");
            if (isSingleText(turn.parts())) {
                message.put("content", textOf(turn.parts()));
                continue;
            }
            ArrayNode content = message.putArray("content");
            for (Part part : turn.parts()) {
                appendBlock(content, part);
            }
        }

        if (prepared.hasTools()) {
            body.set("tools", prepared.tools());
        }
        putSampling(body, options, "top_p", "top_k");
        return body;
    }

    @Override
    protected void translateTool(ToolSchema tool, ObjectNode normalizedParameters, ArrayNode target) {
        ObjectNode row = target.addObject();
        row.put("name", tool.name());
        row.put("description", tool.description());
        row.set("input_schema", normalizedParameters);
    }

    private void appendBlock(ArrayNode content, Part part) {
        if (part instanceof TextPart text) {
            ObjectNode block = content.addObject();
            block.put("type", "text");
            block.put("text", text.content());
        } else if (part instanceof ToolCallPart call) {
            ObjectNode block = content.addObject();
            block.put("type", "tool_use");
            block.put("id", call.id());
            block.put("name", call.name());
            block.set("input", call.arguments());
        } else if (part instanceof ToolResultPart result) {
            ObjectNode block = content.addObject();
            block.put("type", "tool_result");
            block.put("tool_use_id", result.toolCallId());
            block.put("content", result.payloadAsText());
        }
    }
}
