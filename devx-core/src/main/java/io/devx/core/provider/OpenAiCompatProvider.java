package io.devx.core.provider;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.client.ClientKey;
import io.devx.core.error.ConfigException;
import io.devx.core.model.GenerationOptions;
import io.devx.core.translate.OpenAiRequestTranslator;
import io.devx.core.translate.OpenAiResponseTranslator;
import io.devx.core.translate.OpenAiStreamDecoder;
import io.devx.core.translate.StreamDecoder;
import java.io.IOException;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;

/**
 * Any endpoint speaking OpenAI Chat Completions.
 */
public final class OpenAiCompatProvider extends HttpLlmProvider {
    public static final String DEFAULT_API_BASE = "https://api.openai.com/v1";

    private final String apiKey;
    private final Map<String, String> extraHeaders;

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        AdapterContext context
    ) {
        super(
            name,
            apiBase,
            context.clientPool().http(ClientKey.of(name, apiBase, apiKey)),
            new OpenAiRequestTranslator(name, context.schemaCache(), context.repairer()),
            new OpenAiResponseTranslator(name),
            context.retryPolicy()
        );
        this.apiKey = apiKey == null ? "" : apiKey;
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    @Override
    protected Request buildRequest(ObjectNode body, GenerationOptions options, boolean streaming) throws IOException {
        if (apiKey.isBlank()) {
            throw new ConfigException(name, "missing API key for provider " + name);
        }
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(jsonBody(body))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", streaming ? "text/event-stream" : "application/json");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    @Override
    protected ObjectNode streamingBody(ObjectNode body) {
        body.put("stream", true);
        body.putObject("stream_options").put("include_usage", true);
        return body;
    }

    @Override
    protected StreamDecoder newStreamDecoder() {
        return new OpenAiStreamDecoder();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }
}
