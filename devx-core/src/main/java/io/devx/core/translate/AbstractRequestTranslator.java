package io.devx.core.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.error.Stage;
import io.devx.core.error.TranslationException;
import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.TextPart;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolResultPart;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.Turn;
import io.devx.core.repair.ConversationRepairer;
import io.devx.core.repair.RepairResult;
import io.devx.core.schema.SchemaCache;
import io.devx.core.schema.SchemaNormalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared request pipeline: repair, system instruction resolution, orphan filtering and cached tool
 * translation. Subclasses only lay out the provider's JSON.
 */
public abstract class AbstractRequestTranslator implements RequestTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractRequestTranslator.class);

    protected final ObjectMapper mapper = new ObjectMapper();
    protected final String backend;
    private final SchemaCache schemaCache;
    private final ConversationRepairer repairer;
    private final SchemaNormalizer normalizer;

    protected AbstractRequestTranslator(String backend, SchemaCache schemaCache, ConversationRepairer repairer) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.schemaCache = Objects.requireNonNull(schemaCache, "schemaCache must not be null");
        this.repairer = Objects.requireNonNull(repairer, "repairer must not be null");
        this.normalizer = SchemaNormalizer.forDialect(dialect());
    }

    @Override
    public final ProviderRequest translate(Conversation conversation, List<ToolSchema> tools, GenerationOptions options) {
        Objects.requireNonNull(conversation, "conversation must not be null");
        GenerationOptions effective = options == null ? GenerationOptions.forModel("") : options;

        RepairResult repair = repairer.repair(conversation);
        Conversation repaired = repair.conversation();

        Set<String> issued = new HashSet<>();
        Map<String, String> latestCallNames = new HashMap<>();
        Map<ToolResultPart, String> resultNames = new IdentityHashMap<>();
        List<String> dropped = new ArrayList<>();
        List<Turn> wireTurns = new ArrayList<>();

        for (Turn turn : repaired.turns()) {
            if (turn.role() == Role.SYSTEM) {
                continue;
            }
            List<Part> kept = new ArrayList<>();
            for (Part part : turn.parts()) {
                if (part instanceof TextPart text) {
                    if (!text.isEmpty()) {
                        kept.add(text);
                    }
                } else if (part instanceof ToolCallPart call) {
                    if (turn.role() != Role.ASSISTANT) {
                        LOG.debug("Ignoring tool call {} outside an assistant turn for {}", call.id(), backend);
                        continue;
                    }
                    if (!call.hasId()) {
                        throw new TranslationException(
                            backend,
                            Stage.TRANSLATE,
                            "tool call '" + call.name() + "' has no id"
                        );
                    }
                    issued.add(call.id());
                    latestCallNames.put(call.id(), call.name());
                    kept.add(call);
                } else if (part instanceof ToolResultPart result) {
                    if (result.toolCallId() != null && issued.contains(result.toolCallId())) {
                        resultNames.put(result, latestCallNames.get(result.toolCallId()));
                        kept.add(result);
                    } else {
                        dropped.add(result.toolCallId());
                    }
                }
            }
            if (!kept.isEmpty()) {
                appendMerging(wireTurns, new Turn(turn.role(), kept));
            }
        }

        if (!dropped.isEmpty()) {
            LOG.warn("Dropping {} tool result(s) with no matching call for {}: {}", dropped.size(), backend, dropped);
        }

        JsonNode translatedTools = tools == null || tools.isEmpty()
            ? null
            : schemaCache.getOrCompute(dialect(), tools, this::translateTools);

        Prepared prepared = new Prepared(systemInstruction(repaired, effective), wireTurns, resultNames, translatedTools);
        ObjectNode body = buildBody(prepared, effective);
        return new ProviderRequest(dialect(), body, dropped, repair.discardHistory());
    }

    /**
     * Backends expect user and assistant turns to alternate, so a turn that follows one of the same role
     * (for example around a skipped filler turn) is folded into it.
     */
    private static void appendMerging(List<Turn> wireTurns, Turn turn) {
        if (!wireTurns.isEmpty()) {
            Turn previous = wireTurns.get(wireTurns.size() - 1);
            if (previous.role() == turn.role()) {
                List<Part> merged = new ArrayList<>(previous.parts());
                merged.addAll(turn.parts());
                wireTurns.set(wireTurns.size() - 1, new Turn(turn.role(), merged));
                return;
            }
        }
        wireTurns.add(turn);
    }

    protected abstract ObjectNode buildBody(Prepared prepared, GenerationOptions options);

    protected abstract void translateTool(ToolSchema tool, ObjectNode normalizedParameters, ArrayNode target);

    protected JsonNode translateTools(List<ToolSchema> tools) {
        ArrayNode target = mapper.createArrayNode();
        for (ToolSchema tool : tools) {
            translateTool(tool, normalizer.normalize(tool.parameters()), target);
        }
        return target;
    }

    protected static String systemInstruction(Conversation conversation, GenerationOptions options) {
        String fromTurns = conversation.turns().stream()
            .filter(turn -> turn.role() == Role.SYSTEM)
            .map(Turn::text)
            .filter(text -> !text.isBlank())
            .collect(Collectors.joining("\n\n"));
        return fromTurns.isBlank() ? options.systemInstruction() : fromTurns;
    }

    protected static String textOf(List<Part> parts) {
        return parts.stream()
            .filter(TextPart.class::isInstance)
            .map(part -> ((TextPart) part).content())
            .collect(Collectors.joining());
    }

    protected static boolean isSingleText(List<Part> parts) {
        return parts.size() == 1 && parts.get(0) instanceof TextPart;
    }

    protected void putSampling(ObjectNode target, GenerationOptions options, String topPField, String topKField) {
        if (options.temperature() != null) {
            target.put("temperature", options.temperature());
        }
        if (options.topP() != null) {
            target.put(topPField, options.topP());
        }
        if (options.topK() != null && topKField != null) {
            target.put(topKField, options.topK());
        }
    }

    /**
     * Conversation after repair and orphan filtering, ready to be laid out.
     */
    protected record Prepared(
        String systemInstruction,
        List<Turn> turns,
        Map<ToolResultPart, String> resultNames,
        JsonNode tools
    ) {
        public boolean hasTools() {
            return tools != null && tools.size() > 0;
        }

        /**
         * Name of the call a result answers: the nearest call with that id before the result.
         */
        public String toolNameFor(ToolResultPart result) {
            String name = resultNames.get(result);
            return name == null ? "" : name;
        }
    }
}
