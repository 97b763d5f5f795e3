package io.devx.core.agent;

public record AgentSettings(
    String systemPrompt,
    String provider,
    String model,
    int maxToolIterations,
    int maxOutputTokens,
    Double temperature,
    boolean streaming
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "You are DevX, a coding assistant working in the user's workspace. "
        + "Use the list_directory and read_file tools to inspect files before answering questions about them.";

    public AgentSettings {
        maxToolIterations = Math.max(1, maxToolIterations);
        model = model == null ? "" : model.trim();
        systemPrompt = systemPrompt == null ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    public AgentSettings(String systemPrompt, String provider, String model, int maxToolIterations) {
        this(systemPrompt, provider, model, maxToolIterations, 0, null, true);
    }
}
