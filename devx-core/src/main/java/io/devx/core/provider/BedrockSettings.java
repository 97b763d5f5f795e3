package io.devx.core.provider;

public record BedrockSettings(
    String region,
    String apiBase,
    String accessKeyId,
    String secretAccessKey,
    String sessionToken,
    String profile
) {
    public BedrockSettings {
        region = region == null ? "" : region.trim();
        apiBase = apiBase == null ? "" : apiBase.trim();
        accessKeyId = accessKeyId == null ? "" : accessKeyId;
        secretAccessKey = secretAccessKey == null ? "" : secretAccessKey;
        sessionToken = sessionToken == null ? "" : sessionToken;
        profile = profile == null ? "" : profile;
    }

    public String credentialIdentity() {
        return accessKeyId + ":" + secretAccessKey + ":" + sessionToken + ":" + profile;
    }
}
