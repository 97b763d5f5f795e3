package io.devx.core.client;

import io.devx.core.schema.CanonicalJson;
import java.util.Objects;

/**
 * Identity of a pooled client. Credentials are reduced to a short hash so the key itself never holds a secret.
 */
public record ClientKey(String backend, String endpoint, String credentialFingerprint) {

    public ClientKey {
        Objects.requireNonNull(backend, "backend must not be null");
        endpoint = endpoint == null ? "" : endpoint;
        credentialFingerprint = credentialFingerprint == null ? "" : credentialFingerprint;
    }

    public static ClientKey of(String backend, String endpoint, String credential) {
        String fingerprint = credential == null || credential.isEmpty()
            ? ""
            : CanonicalJson.sha256(credential).substring(0, 16);
        return new ClientKey(backend, endpoint, fingerprint);
    }
}
