package io.devx.core.agent;

import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.Part;
import io.devx.core.model.Role;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.Turn;
import io.devx.core.model.UsageMetadata;
import io.devx.core.provider.LlmProvider;
import io.devx.core.provider.ProviderRouter;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.DataQualityWarning;
import io.devx.core.stream.StreamListener;
import io.devx.core.tool.ToolContext;
import io.devx.core.tool.ToolRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one prompt to a final answer: request a turn, run the tools it asks for, feed the results back,
 * repeat. Only one request is outstanding at a time.
 */
public final class AgentOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final ProviderRouter providerRouter;
    private final ToolRegistry toolRegistry;
    private final AtomicBoolean running = new AtomicBoolean();

    public AgentOrchestrator(ProviderRouter providerRouter, ToolRegistry toolRegistry) {
        this.providerRouter = providerRouter;
        this.toolRegistry = toolRegistry;
    }

    public AgentResult run(String userPrompt, AgentSettings settings, Path workspace) {
        return run(userPrompt, settings, workspace, StreamListener.NOOP, new CancellationSignal());
    }

    public AgentResult run(
        String userPrompt,
        AgentSettings settings,
        Path workspace,
        StreamListener listener,
        CancellationSignal cancel
    ) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Another request is already in flight");
        }
        try {
            return loop(userPrompt, settings, workspace, listener == null ? StreamListener.NOOP : listener, cancel);
        } finally {
            running.set(false);
        }
    }

    private AgentResult loop(
        String userPrompt,
        AgentSettings settings,
        Path workspace,
        StreamListener listener,
        CancellationSignal cancel
    ) {
        LlmProvider provider = providerRouter.resolve(settings.provider(), settings.model());
        LOG.debug("Using provider {} with model {}", provider.name(), settings.model());

        GenerationOptions options = new GenerationOptions(
            settings.model(),
            settings.systemPrompt(),
            settings.maxOutputTokens(),
            settings.temperature(),
            null,
            null
        );
        List<ToolSchema> tools = toolRegistry.schemas();
        ToolContext toolContext = new ToolContext(workspace);

        Conversation conversation = Conversation.of(Turn.user(userPrompt));
        UsageMetadata usage = UsageMetadata.ZERO;
        List<DataQualityWarning> warnings = new ArrayList<>();

        for (int i = 0; i < settings.maxToolIterations(); i++) {
            ModelResponse response = settings.streaming()
                ? provider.stream(conversation, tools, options, listener, cancel)
                : provider.generate(conversation, tools, options, cancel);
            usage = usage.plus(response.usage());
            warnings.addAll(response.warnings());
            conversation = conversation.append(response.turn());

            List<ToolCallPart> calls = response.turn().toolCalls();
            if (calls.isEmpty()) {
                return new AgentResult(response.turn().text(), conversation, usage, warnings);
            }

            List<Part> results = new ArrayList<>();
            for (ToolCallPart call : calls) {
                LOG.debug("Executing tool {} for call {}", call.name(), call.id());
                results.add(toolRegistry.execute(call, toolContext));
            }
            conversation = conversation.append(new Turn(Role.USER, results));
        }

        throw new TurnLimitExceededException(settings.maxToolIterations(), conversation);
    }
}
