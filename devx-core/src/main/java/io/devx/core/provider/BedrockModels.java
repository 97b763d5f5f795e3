package io.devx.core.provider;

import java.util.Locale;
import java.util.Map;

/**
 * Friendly Claude model names mapped to Bedrock cross-region inference profile ids.
 */
public final class BedrockModels {
    public static final String DEFAULT_MODEL_ID = "us.anthropic.claude-sonnet-4-20250514-v1:0";
    private static final String PREFIX = "bedrock/";

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("claude-sonnet-4", DEFAULT_MODEL_ID),
        Map.entry("claude-4-sonnet", DEFAULT_MODEL_ID),
        Map.entry("claude-sonnet-4-20250514", DEFAULT_MODEL_ID),
        Map.entry("claude-3-5-sonnet", "us.anthropic.claude-3-5-sonnet-20241022-v2:0"),
        Map.entry("claude-3-5-sonnet-20241022", "us.anthropic.claude-3-5-sonnet-20241022-v2:0"),
        Map.entry("claude-3-5-haiku", "us.anthropic.claude-3-5-haiku-20241022-v1:0"),
        Map.entry("claude-3-5-haiku-20241022", "us.anthropic.claude-3-5-haiku-20241022-v1:0"),
        Map.entry("claude-3-opus", "us.anthropic.claude-3-opus-20240229-v1:0"),
        Map.entry("claude-3-sonnet", "us.anthropic.claude-3-sonnet-20240229-v1:0"),
        Map.entry("claude-3-haiku", "us.anthropic.claude-3-haiku-20240307-v1:0")
    );

    private BedrockModels() {
    }

    public static String resolve(String model) {
        if (model == null || model.isBlank()) {
            return DEFAULT_MODEL_ID;
        }
        String normalized = model.trim();
        if (normalized.toLowerCase(Locale.ROOT).startsWith(PREFIX)) {
            normalized = normalized.substring(PREFIX.length());
        }
        return ALIASES.getOrDefault(normalized.toLowerCase(Locale.ROOT), normalized);
    }
}
