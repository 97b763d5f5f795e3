package io.devx.core.error;

public class ConfigException extends AdapterException {

    public ConfigException(String backend, String detail) {
        super(ErrorKind.CONFIG, backend, Stage.REQUEST, detail);
    }

    public ConfigException(String backend, String detail, Throwable cause) {
        super(ErrorKind.CONFIG, backend, Stage.REQUEST, detail, cause);
    }
}
