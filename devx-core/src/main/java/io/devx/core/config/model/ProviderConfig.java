package io.devx.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders,
    String region,
    @JsonAlias({"access_key_id"}) String accessKeyId,
    @JsonAlias({"secret_access_key"}) String secretAccessKey,
    @JsonAlias({"session_token"}) String sessionToken,
    String profile
) {

    public ProviderConfig {
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig("", null, Map.of(), "", "", "", "", "");
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean configuredForBedrock() {
        return (region != null && !region.isBlank())
            || (profile != null && !profile.isBlank())
            || (
                accessKeyId != null && !accessKeyId.isBlank()
                    && secretAccessKey != null && !secretAccessKey.isBlank()
            );
    }

    public ProviderConfig withApiKey(String value) {
        return new ProviderConfig(value, apiBase, extraHeaders, region, accessKeyId, secretAccessKey, sessionToken, profile);
    }

    public ProviderConfig withAws(String region, String accessKeyId, String secretAccessKey, String sessionToken, String profile) {
        return new ProviderConfig(apiKey, apiBase, extraHeaders, region, accessKeyId, secretAccessKey, sessionToken, profile);
    }
}
