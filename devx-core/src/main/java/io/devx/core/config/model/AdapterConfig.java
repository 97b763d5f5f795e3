package io.devx.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdapterConfig(
    RetryConfig retry,
    RepairConfig repair,
    @JsonAlias({"schema_cache_size"}) int schemaCacheSize,
    HttpConfig http
) {

    public static AdapterConfig defaults() {
        return new AdapterConfig(RetryConfig.defaults(), RepairConfig.defaults(), 64, HttpConfig.defaults());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryConfig(
        @JsonAlias({"max_attempts"}) int maxAttempts,
        @JsonAlias({"base_delay_ms"}) long baseDelayMs,
        double multiplier,
        @JsonAlias({"max_delay_ms"}) long maxDelayMs
    ) {
        public static RetryConfig defaults() {
            return new RetryConfig(3, 250, 2.0, 2000);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RepairConfig(
        @JsonAlias({"min_orphans"}) int minOrphans,
        @JsonAlias({"min_orphan_ratio"}) double minOrphanRatio,
        @JsonAlias({"analysis_prompt_markers"}) List<String> analysisPromptMarkers,
        @JsonAlias({"fallback_prompt"}) String fallbackPrompt
    ) {
        public static RepairConfig defaults() {
            return new RepairConfig(
                3,
                0.8,
                List.of("Analyze *only*", "preceding response"),
                "Please continue with the previous request."
            );
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HttpConfig(
        @JsonAlias({"connect_timeout_seconds"}) int connectTimeoutSeconds,
        @JsonAlias({"read_timeout_seconds"}) int readTimeoutSeconds,
        @JsonAlias({"write_timeout_seconds"}) int writeTimeoutSeconds
    ) {
        public static HttpConfig defaults() {
            return new HttpConfig(20, 90, 20);
        }
    }
}
