package io.devx.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devx.core.model.Conversation;
import io.devx.core.model.FinishReason;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.Role;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.Turn;
import io.devx.core.model.UsageMetadata;
import io.devx.core.provider.LlmProvider;
import io.devx.core.provider.ProviderRegistry;
import io.devx.core.provider.ProviderRouter;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.StreamListener;
import io.devx.core.tool.ToolRegistry;
import io.devx.core.tool.impl.ListDirectoryTool;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentOrchestratorTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path workspace;

    @Test
    void shouldRunToolAndFeedResultBack() throws Exception {
        Files.writeString(workspace.resolve("notes.txt"), "hello");
        ScriptedProvider provider = new ScriptedProvider(conversation -> conversation.size() == 1
            ? new ModelResponse(
                Turn.of(Role.ASSISTANT, new ToolCallPart("c1", "list_directory", MAPPER.createObjectNode().put("path", "."))),
                FinishReason.STOP,
                new UsageMetadata(10, 4)
            )
            : new ModelResponse(Turn.assistant("One file: notes.txt"), FinishReason.STOP, new UsageMetadata(20, 6)));

        AgentResult result = orchestrator(provider).run("what is here?", settings(3, false), workspace);

        assertThat(result.content()).isEqualTo("One file: notes.txt");
        assertThat(result.usage()).isEqualTo(new UsageMetadata(30, 10));
        assertThat(provider.seen).hasSize(2);
        Conversation second = provider.seen.get(1);
        assertThat(second.size()).isEqualTo(3);
        assertThat(second.last().toolResults()).singleElement().satisfies(part -> {
            assertThat(part.toolCallId()).isEqualTo("c1");
            assertThat(part.payloadAsText()).isEqualTo("notes.txt");
        });
        assertThat(provider.toolNames).containsExactly("list_directory");
        assertThat(provider.lastOptions.systemInstruction()).isEqualTo(AgentSettings.DEFAULT_SYSTEM_PROMPT);
    }

    @Test
    void shouldUseStreamingWhenEnabled() {
        ScriptedProvider provider = new ScriptedProvider(conversation ->
            new ModelResponse(Turn.assistant("streamed"), FinishReason.STOP, UsageMetadata.ZERO));

        AgentResult result = orchestrator(provider).run("hi", settings(2, true), workspace);

        assertThat(result.content()).isEqualTo("streamed");
        assertThat(provider.streamed).isTrue();
    }

    @Test
    void shouldStopAfterTurnLimit() {
        ScriptedProvider provider = new ScriptedProvider(conversation -> new ModelResponse(
            Turn.of(Role.ASSISTANT, new ToolCallPart("c" + conversation.size(), "list_directory", null)),
            FinishReason.STOP,
            UsageMetadata.ZERO
        ));

        assertThatThrownBy(() -> orchestrator(provider).run("loop", settings(2, false), workspace))
            .isInstanceOfSatisfying(TurnLimitExceededException.class, ex -> {
                assertThat(ex.limit()).isEqualTo(2);
                assertThat(ex.conversation().size()).isEqualTo(5);
            });
    }

    @Test
    void shouldRejectConcurrentRun() {
        AgentOrchestrator[] holder = new AgentOrchestrator[1];
        List<Throwable> nested = new ArrayList<>();
        ScriptedProvider provider = new ScriptedProvider(conversation -> {
            try {
                holder[0].run("again", settings(1, false), workspace);
            } catch (IllegalStateException ex) {
                nested.add(ex);
            }
            return new ModelResponse(Turn.assistant("done"), FinishReason.STOP, UsageMetadata.ZERO);
        });
        holder[0] = orchestrator(provider);

        AgentResult result = holder[0].run("first", settings(1, false), workspace);

        assertThat(result.content()).isEqualTo("done");
        assertThat(nested).singleElement().extracting(Throwable::getMessage)
            .isEqualTo("Another request is already in flight");
        assertThat(holder[0].run("after", settings(1, false), workspace).content()).isEqualTo("done");
    }

    private AgentOrchestrator orchestrator(LlmProvider provider) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(provider);
        ToolRegistry tools = new ToolRegistry();
        tools.register(new ListDirectoryTool());
        return new AgentOrchestrator(new ProviderRouter(registry, "stub"), tools);
    }

    private static AgentSettings settings(int maxTurns, boolean streaming) {
        return new AgentSettings(null, null, "stub-model", maxTurns, 256, null, streaming);
    }

    private static final class ScriptedProvider implements LlmProvider {
        private final Function<Conversation, ModelResponse> script;
        private final List<Conversation> seen = new ArrayList<>();
        private List<String> toolNames = List.of();
        private GenerationOptions lastOptions;
        private boolean streamed;

        private ScriptedProvider(Function<Conversation, ModelResponse> script) {
            this.script = script;
        }

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public ModelResponse generate(
            Conversation conversation,
            List<ToolSchema> tools,
            GenerationOptions options,
            CancellationSignal cancel
        ) {
            seen.add(conversation);
            toolNames = tools.stream().map(ToolSchema::name).toList();
            lastOptions = options;
            return script.apply(conversation);
        }

        @Override
        public ModelResponse stream(
            Conversation conversation,
            List<ToolSchema> tools,
            GenerationOptions options,
            StreamListener listener,
            CancellationSignal cancel
        ) {
            streamed = true;
            ModelResponse response = generate(conversation, tools, options, cancel);
            listener.onText(response.turn().text());
            return response;
        }
    }
}
