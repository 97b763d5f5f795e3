package io.devx.core.provider;

import io.devx.core.error.ConfigException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a provider: an explicit name wins, then the model name, then the configured default.
 */
public final class ProviderRouter {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRouter.class);

    private final ProviderRegistry registry;
    private final String defaultProvider;

    public ProviderRouter(ProviderRegistry registry, String defaultProvider) {
        this.registry = registry;
        this.defaultProvider = defaultProvider == null ? "" : defaultProvider;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        String name = select(preferredProvider, model);
        LOG.debug("Routing model '{}' to provider {}", model, name);
        return registry.find(name)
            .orElseThrow(() -> new ConfigException(name, "Provider " + name + " is not registered"));
    }

    private String select(String preferredProvider, String model) {
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return preferredProvider;
        }

        String normalizedModel = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("bedrock/")) {
            return Backend.BEDROCK.id();
        }
        if (normalizedModel.contains("claude")) {
            return Backend.ANTHROPIC.id();
        }
        if (normalizedModel.contains("gemini")) {
            return Backend.GEMINI.id();
        }
        if (normalizedModel.contains("gpt")
            || normalizedModel.startsWith("openai/")
            || normalizedModel.matches("o\\d.*")) {
            return Backend.OPENAI.id();
        }
        if (defaultProvider.isBlank()) {
            throw new ConfigException("router", "No provider matches model '" + model + "' and no default is configured");
        }
        return defaultProvider;
    }
}
