package io.devx.core.model;

public enum Role {
    USER,
    ASSISTANT,
    SYSTEM
}
