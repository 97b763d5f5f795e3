package io.devx.core.error;

import java.util.Objects;

/**
 * Root of every failure raised by the adapter. The message is prefixed with {@code [backend/stage]} so
 * a single line in a log or on stderr says where the request failed.
 */
public class AdapterException extends RuntimeException {
    private final ErrorKind kind;
    private final String backend;
    private final Stage stage;
    private final String detail;

    public AdapterException(ErrorKind kind, String backend, Stage stage, String detail) {
        this(kind, backend, stage, detail, null);
    }

    public AdapterException(ErrorKind kind, String backend, Stage stage, String detail, Throwable cause) {
        super(format(backend, stage, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.backend = backend == null || backend.isBlank() ? "unknown" : backend;
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.detail = detail == null ? "" : detail;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String backend() {
        return backend;
    }

    public Stage stage() {
        return stage;
    }

    public String detail() {
        return detail;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    private static String format(String backend, Stage stage, String detail) {
        String name = backend == null || backend.isBlank() ? "unknown" : backend;
        String label = stage == null ? "?" : stage.label();
        return "[" + name + "/" + label + "] " + (detail == null ? "" : detail);
    }
}
