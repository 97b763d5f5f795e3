package io.devx.core.error;

public class AuthException extends AdapterException {

    public AuthException(String backend, Stage stage, String detail) {
        super(ErrorKind.AUTH, backend, stage, detail);
    }

    public AuthException(String backend, Stage stage, String detail, Throwable cause) {
        super(ErrorKind.AUTH, backend, stage, detail, cause);
    }
}
