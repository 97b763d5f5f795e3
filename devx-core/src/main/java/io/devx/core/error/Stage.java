package io.devx.core.error;

public enum Stage {
    TRANSLATE,
    REQUEST,
    STREAM,
    RETRY;

    public String label() {
        return name().toLowerCase();
    }
}
