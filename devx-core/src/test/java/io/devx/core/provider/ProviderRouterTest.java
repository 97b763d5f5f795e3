package io.devx.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.devx.core.error.ConfigException;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {

    @Test
    void shouldRouteByExplicitProviderThenModelThenDefault() {
        ProviderRegistry registry = new ProviderRegistry();
        for (String name : new String[] {"anthropic", "openai", "gemini", "bedrock", "echo"}) {
            registry.register(new EchoProvider(name));
        }
        ProviderRouter router = new ProviderRouter(registry, "echo");

        assertThat(router.resolve("OpenAI", "claude-sonnet-4").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "bedrock/claude-sonnet-4").name()).isEqualTo("bedrock");
        assertThat(router.resolve(null, "claude-sonnet-4").name()).isEqualTo("anthropic");
        assertThat(router.resolve("", "gemini-2.5-pro").name()).isEqualTo("gemini");
        assertThat(router.resolve(null, "gpt-4o").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "o3-mini").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "llama-3").name()).isEqualTo("echo");
    }

    @Test
    void shouldFailForUnregisteredProvider() {
        ProviderRouter router = new ProviderRouter(new ProviderRegistry(), "");

        assertThatThrownBy(() -> router.resolve("mistral", "x")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> router.resolve(null, "llama-3"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("llama-3");
    }
}
