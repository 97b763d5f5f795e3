package io.devx.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.config.model.DevxConfig;
import io.devx.core.config.model.ProviderConfig;
import io.devx.core.config.model.ProvidersConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@code config.json} over the built-in defaults. Blank credentials are then filled from the
 * environment; those values are never written back by {@link #save} or {@link #onboard}.
 */
public final class ConfigService {
    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.mapper = new ObjectMapper();
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public DevxConfig load(Path configPath) throws IOException {
        return applyEnvironment(loadFile(configPath));
    }

    public DevxConfig loadFile(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return DevxConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(DevxConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, DevxConfig.class);
    }

    public DevxConfig applyEnvironment(DevxConfig config) {
        ProvidersConfig providers = config.providers();
        ProviderConfig bedrock = providers.bedrock();
        bedrock = bedrock.withAws(
            orEnv(bedrock.region(), "AWS_REGION", "AWS_DEFAULT_REGION"),
            orEnv(bedrock.accessKeyId(), "AWS_ACCESS_KEY_ID"),
            orEnv(bedrock.secretAccessKey(), "AWS_SECRET_ACCESS_KEY"),
            orEnv(bedrock.sessionToken(), "AWS_SESSION_TOKEN"),
            orEnv(bedrock.profile(), "AWS_PROFILE")
        );
        return config.withProviders(new ProvidersConfig(
            providers.anthropic().withApiKey(orEnv(providers.anthropic().apiKey(), "ANTHROPIC_API_KEY")),
            providers.openai().withApiKey(orEnv(providers.openai().apiKey(), "OPENAI_API_KEY")),
            providers.gemini().withApiKey(orEnv(providers.gemini().apiKey(), "GEMINI_API_KEY", "GOOGLE_API_KEY")),
            bedrock
        ));
    }

    public void save(Path configPath, DevxConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        DevxConfig config;
        if (created || overwrite) {
            config = DevxConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = loadFile(configPath);
        }

        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.agents().defaults().workspace());
        Files.createDirectories(workspace);
        return new OnboardResult(configPath, workspace, created, overwritten);
    }

    public String toPrettyJson(DevxConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private String orEnv(String current, String... names) {
        if (current != null && !current.isBlank()) {
            return current;
        }
        for (String name : names) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return current == null ? "" : current;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = canonicalKey(merged, entry.getKey());
            JsonNode existing = merged.get(key);
            merged.set(key, deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    /**
     * Maps a snake_case key from the file onto the camelCase field the defaults already carry, so the merged
     * tree never holds both spellings of one property.
     */
    private static String canonicalKey(ObjectNode base, String key) {
        if (base.has(key) || key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder camel = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = camel.length() > 0;
            } else {
                camel.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        String candidate = camel.toString();
        return base.has(candidate) ? candidate : key;
    }
}
