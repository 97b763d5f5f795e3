package io.devx.core.provider;

import io.devx.core.translate.Dialect;
import java.util.Locale;
import java.util.Optional;

public enum Backend {
    ANTHROPIC("anthropic", Dialect.ANTHROPIC_MESSAGES),
    BEDROCK("bedrock", Dialect.ANTHROPIC_MESSAGES),
    OPENAI("openai", Dialect.OPENAI_CHAT),
    GEMINI("gemini", Dialect.GEMINI);

    private final String id;
    private final Dialect dialect;

    Backend(String id, Dialect dialect) {
        this.id = id;
        this.dialect = dialect;
    }

    public String id() {
        return id;
    }

    public Dialect dialect() {
        return dialect;
    }

    public static Optional<Backend> fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (Backend backend : values()) {
            if (backend.id.equals(normalized)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }
}
