package io.devx.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devx.core.client.ClientPool;
import io.devx.core.config.model.DevxConfig;
import io.devx.core.config.model.ProviderConfig;
import io.devx.core.config.model.ProvidersConfig;
import io.devx.core.error.ConfigException;
import io.devx.core.model.Conversation;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.Turn;
import io.devx.core.retry.CancellationSignal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderFactoryTest {

    @Test
    void shouldRegisterDisabledProvidersForMissingCredentials() {
        DevxConfig config = DevxConfig.defaults();
        try (ClientPool pool = ProviderFactory.clientPool(config.adapter())) {
            ProviderRegistry registry = ProviderFactory.registry(config, ProviderFactory.context(config.adapter(), pool));

            assertThat(registry.names()).containsExactly("anthropic", "bedrock", "echo", "gemini", "openai");
            assertThat(registry.find("anthropic")).get().isInstanceOf(DisabledProvider.class);
            assertThatThrownBy(() -> registry.find("openai").orElseThrow().generate(
                Conversation.of(Turn.user("hi")),
                List.of(),
                GenerationOptions.forModel("gpt-4o"),
                new CancellationSignal()
            ))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("missing API key");
        }
    }

    @Test
    void shouldBuildConfiguredProvidersSharingOnePool() {
        DevxConfig defaults = DevxConfig.defaults();
        ProvidersConfig providers = defaults.providers();
        DevxConfig config = defaults.withProviders(new ProvidersConfig(
            providers.anthropic().withApiKey("sk-ant"),
            providers.openai().withApiKey("sk-openai"),
            providers.gemini(),
            providers.bedrock()
        ));
        try (ClientPool pool = ProviderFactory.clientPool(config.adapter())) {
            ProviderRegistry registry = ProviderFactory.registry(config, ProviderFactory.context(config.adapter(), pool));

            assertThat(registry.find("anthropic")).get().isInstanceOf(AnthropicProvider.class);
            assertThat(registry.find("openai")).get().isInstanceOf(OpenAiCompatProvider.class);
            assertThat(registry.find("gemini")).get().isInstanceOf(DisabledProvider.class);
            assertThat(pool.size()).isEqualTo(2);
        }
    }

    @Test
    void shouldCarryAdapterSettingsIntoContext() {
        DevxConfig config = DevxConfig.defaults();
        try (ClientPool pool = new ClientPool()) {
            AdapterContext context = ProviderFactory.context(config.adapter(), pool);

            assertThat(context.retryPolicy().maxAttempts()).isEqualTo(config.adapter().retry().maxAttempts());
            assertThat(context.repairer().policy().minOrphans()).isEqualTo(3);
        }
    }

    @Test
    void shouldRequireRegionOrCredentialsForBedrock() {
        assertThat(new ProviderConfig(null, null, null, null, null, null, null, null).configuredForBedrock()).isFalse();
        assertThat(new ProviderConfig(null, null, null, "us-east-1", null, null, null, null).configuredForBedrock()).isTrue();
    }
}
