package io.devx.core.error;

public class TranslationException extends AdapterException {

    public TranslationException(String backend, Stage stage, String detail) {
        super(ErrorKind.TRANSLATION, backend, stage, detail);
    }

    public TranslationException(String backend, Stage stage, String detail, Throwable cause) {
        super(ErrorKind.TRANSLATION, backend, stage, detail, cause);
    }
}
