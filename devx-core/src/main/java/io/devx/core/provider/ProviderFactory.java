package io.devx.core.provider;

import io.devx.core.client.ClientPool;
import io.devx.core.client.HttpSettings;
import io.devx.core.config.model.AdapterConfig;
import io.devx.core.config.model.DevxConfig;
import io.devx.core.config.model.ProviderConfig;
import io.devx.core.repair.ConversationRepairer;
import io.devx.core.repair.RepairPolicy;
import io.devx.core.retry.RetryPolicy;
import io.devx.core.schema.SchemaCache;
import java.time.Duration;

/**
 * Builds the session's providers from configuration. Backends without credentials are registered as
 * {@link DisabledProvider}s so routing to them fails with a clear message.
 */
public final class ProviderFactory {

    private ProviderFactory() {
    }

    public static ClientPool clientPool(AdapterConfig adapter) {
        AdapterConfig.HttpConfig http = adapter.http();
        return new ClientPool(new HttpSettings(
            Duration.ofSeconds(http.connectTimeoutSeconds()),
            Duration.ofSeconds(http.readTimeoutSeconds()),
            Duration.ofSeconds(http.writeTimeoutSeconds())
        ));
    }

    public static AdapterContext context(AdapterConfig adapter, ClientPool clientPool) {
        AdapterConfig.RetryConfig retry = adapter.retry();
        AdapterConfig.RepairConfig repair = adapter.repair();
        return new AdapterContext(
            new SchemaCache(adapter.schemaCacheSize()),
            new ConversationRepairer(new RepairPolicy(
                repair.minOrphans(),
                repair.minOrphanRatio(),
                repair.analysisPromptMarkers(),
                repair.fallbackPrompt()
            )),
            new RetryPolicy(
                retry.maxAttempts(),
                Duration.ofMillis(retry.baseDelayMs()),
                retry.multiplier(),
                Duration.ofMillis(retry.maxDelayMs())
            ),
            clientPool
        );
    }

    public static ProviderRegistry registry(DevxConfig config, AdapterContext context) {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(anthropic(config.providers().anthropic(), context));
        registry.register(openai(config.providers().openai(), context));
        registry.register(gemini(config.providers().gemini(), context));
        registry.register(bedrock(config.providers().bedrock(), context));
        registry.register(new EchoProvider("echo"));
        return registry;
    }

    private static LlmProvider anthropic(ProviderConfig provider, AdapterContext context) {
        String name = Backend.ANTHROPIC.id();
        if (!provider.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        return new AnthropicProvider(name, provider.apiKey(), apiBase(provider, AnthropicProvider.DEFAULT_API_BASE), context);
    }

    private static LlmProvider openai(ProviderConfig provider, AdapterContext context) {
        String name = Backend.OPENAI.id();
        if (!provider.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        return new OpenAiCompatProvider(
            name,
            provider.apiKey(),
            apiBase(provider, OpenAiCompatProvider.DEFAULT_API_BASE),
            provider.extraHeaders(),
            context
        );
    }

    private static LlmProvider gemini(ProviderConfig provider, AdapterContext context) {
        String name = Backend.GEMINI.id();
        if (!provider.configured()) {
            return new DisabledProvider(name, "missing API key");
        }
        return new GeminiProvider(name, provider.apiKey(), apiBase(provider, GeminiProvider.DEFAULT_API_BASE), context);
    }

    private static LlmProvider bedrock(ProviderConfig provider, AdapterContext context) {
        String name = Backend.BEDROCK.id();
        if (!provider.configuredForBedrock()) {
            return new DisabledProvider(name, "missing AWS region, profile or access keys");
        }
        return new BedrockProvider(
            name,
            new BedrockSettings(
                provider.region(),
                provider.apiBase(),
                provider.accessKeyId(),
                provider.secretAccessKey(),
                provider.sessionToken(),
                provider.profile()
            ),
            context
        );
    }

    private static String apiBase(ProviderConfig provider, String defaultBase) {
        return provider.apiBase() == null || provider.apiBase().isBlank() ? defaultBase : provider.apiBase();
    }
}
