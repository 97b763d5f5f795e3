package io.devx.core.translate;

public enum Dialect {
    ANTHROPIC_MESSAGES,
    OPENAI_CHAT,
    GEMINI
}
