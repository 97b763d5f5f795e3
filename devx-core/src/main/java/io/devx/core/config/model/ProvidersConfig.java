package io.devx.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig anthropic,
    ProviderConfig openai,
    ProviderConfig gemini,
    ProviderConfig bedrock
) {

    public ProvidersConfig {
        anthropic = anthropic == null ? ProviderConfig.defaults() : anthropic;
        openai = openai == null ? ProviderConfig.defaults() : openai;
        gemini = gemini == null ? ProviderConfig.defaults() : gemini;
        bedrock = bedrock == null ? ProviderConfig.defaults() : bedrock;
    }

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults(),
            ProviderConfig.defaults()
        );
    }
}
