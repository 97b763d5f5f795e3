package io.devx.core.provider;

import io.devx.core.model.Conversation;
import io.devx.core.model.FinishReason;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.model.ToolCallPart;
import io.devx.core.model.ToolSchema;
import io.devx.core.model.UsageMetadata;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.retry.FailureClassifier;
import io.devx.core.retry.RetryExecutor;
import io.devx.core.retry.RetryPolicy;
import io.devx.core.stream.DataQualityWarning;
import io.devx.core.stream.StreamListener;
import io.devx.core.stream.StreamReassembler;
import io.devx.core.translate.ProviderRequest;
import io.devx.core.translate.RequestTranslator;
import java.util.List;
import java.util.Objects;

/**
 * Translate, send under the retry executor, translate back. A streaming attempt is only retried while
 * nothing has reached the caller's listener.
 */
public abstract class AbstractLlmProvider implements LlmProvider {
    protected final String name;
    protected final FailureClassifier classifier;
    private final RequestTranslator translator;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    protected AbstractLlmProvider(String name, RequestTranslator translator, RetryPolicy retryPolicy) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.translator = Objects.requireNonNull(translator, "translator must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.classifier = new FailureClassifier(name);
        this.retryExecutor = new RetryExecutor(name, classifier);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public final ModelResponse generate(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        CancellationSignal cancel
    ) {
        CancellationSignal signal = cancel == null ? new CancellationSignal() : cancel;
        ProviderRequest request = translator.translate(conversation, tools, options);
        return retryExecutor.execute(() -> send(request, options, signal), retryPolicy, signal);
    }

    @Override
    public final ModelResponse stream(
        Conversation conversation,
        List<ToolSchema> tools,
        GenerationOptions options,
        StreamListener listener,
        CancellationSignal cancel
    ) {
        CancellationSignal signal = cancel == null ? new CancellationSignal() : cancel;
        ProviderRequest request = translator.translate(conversation, tools, options);
        EmissionTracker tracker = new EmissionTracker(listener == null ? StreamListener.NOOP : listener);
        return retryExecutor.execute(
            () -> {
                StreamReassembler reassembler = new StreamReassembler(name, tracker);
                openStream(request, options, reassembler, signal);
                return reassembler.result();
            },
            failure -> !tracker.emitted && classifier.isRetryable(failure),
            retryPolicy,
            signal
        );
    }

    protected abstract ModelResponse send(
        ProviderRequest request,
        GenerationOptions options,
        CancellationSignal cancel
    ) throws Exception;

    /**
     * Feeds every event of one streaming attempt into {@code reassembler}, ending with a message end.
     */
    protected abstract void openStream(
        ProviderRequest request,
        GenerationOptions options,
        StreamReassembler reassembler,
        CancellationSignal cancel
    ) throws Exception;

    private static final class EmissionTracker implements StreamListener {
        private final StreamListener delegate;
        private volatile boolean emitted;

        private EmissionTracker(StreamListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onText(String text) {
            emitted = true;
            delegate.onText(text);
        }

        @Override
        public void onToolCall(ToolCallPart call) {
            emitted = true;
            delegate.onToolCall(call);
        }

        @Override
        public void onWarning(DataQualityWarning warning) {
            emitted = true;
            delegate.onWarning(warning);
        }

        @Override
        public void onComplete(FinishReason finishReason, UsageMetadata usage) {
            delegate.onComplete(finishReason, usage);
        }
    }
}
