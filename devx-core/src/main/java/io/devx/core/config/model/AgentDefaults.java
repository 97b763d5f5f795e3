package io.devx.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String workspace,
    String provider,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    double temperature,
    @JsonAlias({"max_tool_iterations"}) int maxToolIterations
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "~/.devx/workspace",
            "anthropic",
            "claude-sonnet-4-20250514",
            8192,
            0.0,
            20
        );
    }
}
