package io.devx.core.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

    @Test
    void shouldRunCallbacksOnceOnCancel() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        signal.onCancel(runs::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void shouldNotRunClosedRegistration() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger runs = new AtomicInteger();
        try (CancellationSignal.Registration ignored = signal.onCancel(runs::incrementAndGet)) {
            assertThat(runs.get()).isZero();
        }

        signal.cancel();

        assertThat(runs.get()).isZero();
    }

    @Test
    void shouldRunLateRegistrationImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger runs = new AtomicInteger();

        signal.onCancel(runs::incrementAndGet);

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void shouldTimeOutAwaitWhenNotCancelled() throws Exception {
        CancellationSignal signal = new CancellationSignal();

        assertThat(signal.await(Duration.ofMillis(10))).isFalse();
        signal.cancel();
        assertThat(signal.await(Duration.ofSeconds(5))).isTrue();
    }
}
