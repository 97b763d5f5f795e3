package io.devx.core.error;

public class UpstreamProtocolException extends AdapterException {

    public UpstreamProtocolException(String backend, Stage stage, String detail) {
        super(ErrorKind.UPSTREAM_PROTOCOL, backend, stage, detail);
    }

    public UpstreamProtocolException(String backend, Stage stage, String detail, Throwable cause) {
        super(ErrorKind.UPSTREAM_PROTOCOL, backend, stage, detail, cause);
    }
}
