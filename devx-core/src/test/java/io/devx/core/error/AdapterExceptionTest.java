package io.devx.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class AdapterExceptionTest {

    @Test
    void shouldPrefixMessageWithBackendAndStage() {
        AuthException ex = new AuthException("openai", Stage.REQUEST, "invalid api key");

        assertThat(ex).hasMessage("[openai/request] invalid api key");
        assertThat(ex.kind()).isEqualTo(ErrorKind.AUTH);
        assertThat(ex.retryable()).isFalse();
    }

    @Test
    void shouldFallBackToUnknownBackend() {
        ConfigException ex = new ConfigException(" ", "missing key");

        assertThat(ex.backend()).isEqualTo("unknown");
        assertThat(ex).hasMessage("[unknown/request] missing key");
    }

    @Test
    void shouldOnlyMarkTransientFailuresRetryable() {
        TransientNetworkException transientFailure =
            new TransientNetworkException("gemini", Stage.STREAM, 503, "overloaded", null);

        assertThat(transientFailure.retryable()).isTrue();
        assertThat(transientFailure.statusCode()).isEqualTo(503);
        assertThat(new TransientNetworkException("gemini", Stage.REQUEST, "reset", new IOException()).statusCode())
            .isEqualTo(-1);
        assertThat(new RequestRejectedException("gemini", Stage.REQUEST, "bad").retryable()).isFalse();
    }

    @Test
    void shouldCarryLastFailureWhenRetriesRunOut() {
        TransientNetworkException last = new TransientNetworkException("anthropic", Stage.REQUEST, 529, "overloaded", null);

        RetryExhaustedException ex = new RetryExhaustedException("anthropic", 4, last);

        assertThat(ex.attempts()).isEqualTo(4);
        assertThat(ex.getCause()).isSameAs(last);
        assertThat(ex.getMessage())
            .isEqualTo("[anthropic/retry] gave up after 4 attempt(s): [anthropic/request] overloaded");
    }
}
