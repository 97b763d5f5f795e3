package io.devx.core.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.client.ClientKey;
import io.devx.core.error.ConfigException;
import io.devx.core.model.GenerationOptions;
import io.devx.core.translate.GeminiRequestTranslator;
import io.devx.core.translate.GeminiResponseTranslator;
import io.devx.core.translate.GeminiStreamDecoder;
import io.devx.core.translate.StreamDecoder;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.Request;

public final class GeminiProvider extends HttpLlmProvider {
    public static final String DEFAULT_API_BASE = "https://generativelanguage.googleapis.com/v1beta";

    private final String apiKey;

    public GeminiProvider(String name, String apiKey, String apiBase, AdapterContext context) {
        super(
            name,
            apiBase,
            context.clientPool().http(ClientKey.of(name, apiBase, apiKey)),
            new GeminiRequestTranslator(name, context.schemaCache(), context.repairer()),
            new GeminiResponseTranslator(name),
            context.retryPolicy()
        );
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    protected Request buildRequest(ObjectNode body, GenerationOptions options, boolean streaming) throws IOException {
        if (apiKey.isBlank()) {
            throw new ConfigException(name, "missing API key for provider " + name);
        }
        if (options.model().isBlank()) {
            throw new ConfigException(name, "missing model for provider " + name);
        }
        return new Request.Builder()
            .url(modelUrl(options.model(), streaming))
            .post(jsonBody(body))
            .header("x-goog-api-key", apiKey)
            .header("Content-Type", "application/json")
            .build();
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new GeminiStreamDecoder();
    }

    private HttpUrl modelUrl(String model, boolean streaming) {
        String id = model.startsWith("models/") ? model.substring("models/".length()) : model;
        HttpUrl.Builder builder = apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(id + (streaming ? ":streamGenerateContent" : ":generateContent"));
        if (streaming) {
            builder.addQueryParameter("alt", "sse");
        }
        return builder.build();
    }
}
