package io.devx.core.error;

public enum ErrorKind {
    TRANSLATION(false),
    UPSTREAM_PROTOCOL(false),
    TRANSIENT_NETWORK(true),
    AUTH(false),
    CONFIG(false),
    REQUEST_REJECTED(false),
    CANCELLED(false),
    RETRIES_EXHAUSTED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
