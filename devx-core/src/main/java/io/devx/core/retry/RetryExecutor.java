package io.devx.core.retry;

import io.devx.core.error.AdapterException;
import io.devx.core.error.CancelledException;
import io.devx.core.error.RetryExhaustedException;
import io.devx.core.error.Stage;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a request, retrying failures the predicate accepts with exponential backoff. Non-retryable failures
 * surface on first occurrence, classified into an {@link AdapterException}.
 */
public final class RetryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    private final String backend;
    private final FailureClassifier classifier;

    public RetryExecutor(String backend) {
        this(backend, new FailureClassifier(backend));
    }

    public RetryExecutor(String backend, FailureClassifier classifier) {
        this.backend = backend;
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public <T> T execute(Callable<T> requestFn, Predicate<Throwable> isRetryable, int maxAttempts, Duration baseDelay) {
        return execute(requestFn, isRetryable, RetryPolicy.of(maxAttempts, baseDelay), new CancellationSignal());
    }

    public <T> T execute(Callable<T> requestFn, RetryPolicy policy, CancellationSignal cancel) {
        return execute(requestFn, classifier::isRetryable, policy, cancel);
    }

    public <T> T execute(
        Callable<T> requestFn,
        Predicate<Throwable> isRetryable,
        RetryPolicy policy,
        CancellationSignal cancel
    ) {
        Objects.requireNonNull(requestFn, "requestFn must not be null");
        Objects.requireNonNull(isRetryable, "isRetryable must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        CancellationSignal signal = cancel == null ? new CancellationSignal() : cancel;

        Throwable last = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (signal.isCancelled()) {
                throw new CancelledException(backend, Stage.RETRY, last);
            }
            try {
                return requestFn.call();
            } catch (CancelledException e) {
                throw e;
            } catch (Exception e) {
                if (signal.isCancelled()) {
                    throw new CancelledException(backend, Stage.REQUEST, e);
                }
                if (!isRetryable.test(e)) {
                    throw classifier.classify(e, Stage.REQUEST);
                }
                last = e;
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                Duration delay = policy.delayAfter(attempt);
                LOG.warn(
                    "Attempt {}/{} against {} failed ({}); retrying in {} ms",
                    attempt,
                    policy.maxAttempts(),
                    backend,
                    e.getMessage(),
                    delay.toMillis()
                );
                pause(delay, signal, e);
            }
        }
        throw new RetryExhaustedException(backend, policy.maxAttempts(), last);
    }

    private void pause(Duration delay, CancellationSignal signal, Throwable last) {
        try {
            if (signal.await(delay)) {
                throw new CancelledException(backend, Stage.RETRY, last);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancelledException(backend, Stage.RETRY, ie);
        }
    }
}
