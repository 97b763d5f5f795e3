package io.devx.core.model;

public enum FinishReason {
    STOP,
    MAX_OUTPUT_REACHED,
    CONTENT_FILTERED,
    OTHER
}
