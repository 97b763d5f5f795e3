package io.devx.core.error;

public class RequestRejectedException extends AdapterException {

    public RequestRejectedException(String backend, Stage stage, String detail) {
        super(ErrorKind.REQUEST_REJECTED, backend, stage, detail);
    }

    public RequestRejectedException(String backend, Stage stage, String detail, Throwable cause) {
        super(ErrorKind.REQUEST_REJECTED, backend, stage, detail, cause);
    }
}
