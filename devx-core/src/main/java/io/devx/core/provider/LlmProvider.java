package io.devx.core.provider;

import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.ToolSchema;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.StreamListener;
import java.util.List;

public interface LlmProvider {
    String name();

    ModelResponse generate(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        CancellationSignal cancel
    );

    /**
     * Streams one assistant turn, forwarding text, completed tool calls and warnings to {@code listener} as
     * they are reassembled. Returns the same turn the listener has seen.
     */
    ModelResponse stream(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        StreamListener listener,
        CancellationSignal cancel
    );
}
