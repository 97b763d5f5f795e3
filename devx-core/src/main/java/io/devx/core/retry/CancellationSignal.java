package io.devx.core.retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation shared by the caller and an in-flight request. Callbacks registered with
 * {@link #onCancel(Runnable)} run once, on the thread that calls {@link #cancel()}.
 */
public final class CancellationSignal {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation callback failed: {}", e.getMessage());
            }
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Registration onCancel(Runnable callback) {
        if (isCancelled()) {
            callback.run();
            return () -> {
            };
        }
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits up to {@code timeout}; returns true if cancelled before or during the wait.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
