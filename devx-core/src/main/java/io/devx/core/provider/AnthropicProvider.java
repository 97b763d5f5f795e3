package io.devx.core.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.client.ClientKey;
import io.devx.core.error.ConfigException;
import io.devx.core.model.GenerationOptions;
import io.devx.core.translate.AnthropicRequestTranslator;
import io.devx.core.translate.AnthropicResponseTranslator;
import io.devx.core.translate.AnthropicStreamDecoder;
import io.devx.core.translate.StreamDecoder;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.Request;

public final class AnthropicProvider extends HttpLlmProvider {
    public static final String DEFAULT_API_BASE = "https://api.anthropic.com/v1";
    private static final String API_VERSION = "2023-06-01";

    private final String apiKey;

    public AnthropicProvider(String name, String apiKey, String apiBase, AdapterContext context) {
        super(
            name,
            apiBase,
            context.clientPool().http(ClientKey.of(name, apiBase, apiKey)),
            new AnthropicRequestTranslator(name, context.schemaCache(), context.repairer()),
            new AnthropicResponseTranslator(name),
            context.retryPolicy()
        );
        this.apiKey = apiKey == null ? "" : apiKey;
    }

    @Override
    protected Request buildRequest(ObjectNode body, GenerationOptions options, boolean streaming) throws IOException {
        if (apiKey.isBlank()) {
            throw new ConfigException(name, "missing API key for provider " + name);
        }
        return new Request.Builder()
            .url(messagesUrl())
            .post(jsonBody(body))
            .header("x-api-key", apiKey)
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .header("accept", streaming ? "text/event-stream" : "application/json")
            .build();
    }

    @Override
    protected ObjectNode streamingBody(ObjectNode body) {
        return body.put("stream", true);
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new AnthropicStreamDecoder(name);
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }
}
