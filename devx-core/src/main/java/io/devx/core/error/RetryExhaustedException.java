package io.devx.core.error;

public class RetryExhaustedException extends AdapterException {
    private final int attempts;

    public RetryExhaustedException(String backend, int attempts, Throwable lastFailure) {
        super(
            ErrorKind.RETRIES_EXHAUSTED,
            backend,
            Stage.RETRY,
            "gave up after " + attempts + " attempt(s)" + describe(lastFailure),
            lastFailure
        );
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable failure) {
        if (failure == null || failure.getMessage() == null) {
            return "";
        }
        return ": " + failure.getMessage();
    }
}
