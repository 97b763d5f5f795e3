package io.devx.core.provider;

import io.devx.core.error.ConfigException;
import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.ToolSchema;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.StreamListener;
import java.util.List;

/**
 * Provider placeholder used when a backend is not configured.
 * Every call fails with a {@link ConfigException} naming what is missing.
 */
public final class DisabledProvider implements LlmProvider {
    private final String name;
    private final String reason;

    public DisabledProvider(String name, String reason) {
        this.name = name;
        this.reason = reason == null || reason.isBlank() ? "provider is disabled" : reason;
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
        throw notConfigured();
    }

    @Override
    public ModelResponse stream(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        StreamListener listener,
        CancellationSignal cancel
    ) {
        throw notConfigured();
    }

    private ConfigException notConfigured() {
        return new ConfigException(name, "provider " + name + " is not configured (" + reason + ")");
    }
}
