package io.devx.core.client;

import java.time.Duration;

public record HttpSettings(Duration connectTimeout, Duration readTimeout, Duration writeTimeout) {

    public HttpSettings {
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(20) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(90) : readTimeout;
        writeTimeout = writeTimeout == null ? Duration.ofSeconds(20) : writeTimeout;
    }

    public static HttpSettings defaults() {
        return new HttpSettings(null, null, null);
    }
}
