package io.devx.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DevxConfig(
    AgentsConfig agents,
    ProvidersConfig providers,
    AdapterConfig adapter
) {

    public static DevxConfig defaults() {
        return new DevxConfig(
            AgentsConfig.defaultConfig(),
            ProvidersConfig.defaults(),
            AdapterConfig.defaults()
        );
    }

    public DevxConfig withProviders(ProvidersConfig value) {
        return new DevxConfig(agents, value, adapter);
    }
}
