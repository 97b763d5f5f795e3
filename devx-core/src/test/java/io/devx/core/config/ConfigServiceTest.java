package io.devx.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.devx.core.config.model.DevxConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldMergePartialFileOverDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "agents": { "defaults": { "model": "gpt-4o" } },
              "providers": { "openai": { "api_key": "sk-file", "extra_headers": { "X_Team": "core" } } },
              "adapter": { "retry": { "max_attempts": 5 }, "schema_cache_size": 8 }
            }
            """, StandardCharsets.UTF_8);

        DevxConfig config = new ConfigService(Map.of()).load(configPath);

        assertThat(config.agents().defaults().model()).isEqualTo("gpt-4o");
        assertThat(config.agents().defaults().provider()).isEqualTo("anthropic");
        assertThat(config.providers().openai().apiKey()).isEqualTo("sk-file");
        assertThat(config.adapter().retry().maxAttempts()).isEqualTo(5);
        assertThat(config.adapter().retry().baseDelayMs()).isEqualTo(250);
        assertThat(config.adapter().repair().minOrphanRatio()).isEqualTo(0.8);
        assertThat(config.adapter().schemaCacheSize()).isEqualTo(8);
        assertThat(config.providers().openai().extraHeaders()).containsEntry("X_Team", "core");
    }

    @Test
    void shouldFillBlankCredentialsFromEnvironment() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"providers\": {\"anthropic\": {\"apiKey\": \"sk-file\"}}}", StandardCharsets.UTF_8);
        ConfigService service = new ConfigService(Map.of(
            "ANTHROPIC_API_KEY", "sk-env-ignored",
            "GOOGLE_API_KEY", "g-env",
            "AWS_DEFAULT_REGION", "eu-west-1",
            "AWS_PROFILE", "dev"
        ));

        DevxConfig config = service.load(configPath);

        assertThat(config.providers().anthropic().apiKey()).isEqualTo("sk-file");
        assertThat(config.providers().gemini().apiKey()).isEqualTo("g-env");
        assertThat(config.providers().openai().configured()).isFalse();
        assertThat(config.providers().bedrock().region()).isEqualTo("eu-west-1");
        assertThat(config.providers().bedrock().profile()).isEqualTo("dev");
        assertThat(config.providers().bedrock().configuredForBedrock()).isTrue();
    }

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws Exception {
        DevxConfig config = new ConfigService(Map.of()).load(tempDir.resolve("missing.json"));

        assertThat(config).isEqualTo(DevxConfig.defaults());
    }

    @Test
    void shouldOnboardWithoutPersistingEnvironmentSecrets() throws Exception {
        String originalHome = System.getProperty("user.home");
        System.setProperty("user.home", tempDir.toString());
        try {
            Path configPath = tempDir.resolve(".devx/config.json");
            ConfigService service = new ConfigService(Map.of("OPENAI_API_KEY", "sk-env"));

            OnboardResult created = service.onboard(configPath, false);
            OnboardResult refreshed = service.onboard(configPath, false);
            OnboardResult overwritten = service.onboard(configPath, true);

            assertThat(created.createdConfig()).isTrue();
            assertThat(created.workspacePath()).isEqualTo(tempDir.resolve(".devx/workspace"));
            assertThat(Files.isDirectory(created.workspacePath())).isTrue();
            assertThat(refreshed.createdConfig()).isFalse();
            assertThat(refreshed.overwrittenConfig()).isFalse();
            assertThat(overwritten.overwrittenConfig()).isTrue();
            assertThat(Files.readString(configPath)).doesNotContain("sk-env");
        } finally {
            System.setProperty("user.home", originalHome);
        }
    }

    @Test
    void shouldExpandHomeInWorkspacePath() {
        assertThat(ConfigPaths.resolveWorkspace("~/projects"))
            .isEqualTo(Path.of(System.getProperty("user.home")).resolve("projects"));
        assertThat(ConfigPaths.resolveWorkspace("")).endsWith(Path.of(".devx", "workspace"));
    }
}
