package io.devx.core.error;

public class CancelledException extends AdapterException {

    public CancelledException(String backend, Stage stage) {
        super(ErrorKind.CANCELLED, backend, stage, "request cancelled");
    }

    public CancelledException(String backend, Stage stage, Throwable cause) {
        super(ErrorKind.CANCELLED, backend, stage, "request cancelled", cause);
    }
}
