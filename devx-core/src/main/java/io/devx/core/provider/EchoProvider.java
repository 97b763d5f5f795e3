package io.devx.core.provider;

import io.devx.core.error.CancelledException;
import io.devx.core.error.Stage;
import io.devx.core.model.Conversation;
import io.devx.core.model.FinishReason;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.Role;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.Turn;
import io.devx.core.model.UsageMetadata;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.StreamEvent;
import io.devx.core.stream.StreamListener;
import io.devx.core.stream.StreamReassembler;
import java.util.List;

/**
 * Offline provider that answers with the latest user text. Never calls tools.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ModelResponse generate(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        CancellationSignal cancel
    ) {
        if (cancel != null && cancel.isCancelled()) {
            throw new CancelledException(name, Stage.REQUEST);
        }
        return new ModelResponse(Turn.assistant(reply(conversation)), FinishReason.STOP, UsageMetadata.ZERO);
    }

    @Override
    public ModelResponse stream(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        StreamListener listener,
        CancellationSignal cancel
    ) {
        StreamReassembler reassembler = new StreamReassembler(name, listener);
        if (cancel != null && cancel.isCancelled()) {
            reassembler.cancel();
        } else {
            reassembler.accept(new StreamEvent.TextDelta(reply(conversation)));
            reassembler.accept(new StreamEvent.MessageEnd(FinishReason.STOP, UsageMetadata.ZERO));
        }
        return reassembler.result();
    }

    private String reply(Conversation conversation) {
        String lastUserMessage = conversation.turns().stream()
            .filter(turn -> turn.role() == Role.USER)
            .map(Turn::text)
            .filter(text -> !text.isBlank())
            .reduce((first, second) -> second)
            .orElse("");
        return "[" + name + "] " + lastUserMessage;
    }
}
