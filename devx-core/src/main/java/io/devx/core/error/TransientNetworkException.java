package io.devx.core.error;

/**
 * A failure worth retrying: timeouts, dropped connections, throttling and server-side errors.
 * {@code statusCode} is {@code -1} when no HTTP status was received.
 */
public class TransientNetworkException extends AdapterException {
    private final int statusCode;

    public TransientNetworkException(String backend, Stage stage, String detail, Throwable cause) {
        this(backend, stage, -1, detail, cause);
    }

    public TransientNetworkException(String backend, Stage stage, int statusCode, String detail, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, backend, stage, detail, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
