package io.devx.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.devx.core.error.CancelledException;
import io.devx.core.error.Stage;
import io.devx.core.error.UpstreamProtocolException;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.retry.RetryPolicy;
import io.devx.core.stream.StreamReassembler;
import io.devx.core.translate.ProviderRequest;
import io.devx.core.translate.RequestTranslator;
import io.devx.core.translate.ResponseTranslator;
import io.devx.core.translate.StreamDecoder;
import java.io.IOException;
import java.util.Objects;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

/**
 * Base for backends reached over HTTPS with JSON bodies and server-sent event streams.
 */
public abstract class HttpLlmProvider extends AbstractLlmProvider {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    protected final ObjectMapper mapper = new ObjectMapper();
    protected final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ResponseTranslator responseTranslator;

    protected HttpLlmProvider(
        String name,
        String apiBase,
        OkHttpClient client,
        RequestTranslator translator,
        ResponseTranslator responseTranslator,
        RetryPolicy retryPolicy
    ) {
        super(name, translator, retryPolicy);
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.responseTranslator = Objects.requireNonNull(responseTranslator, "responseTranslator must not be null");
    }

    protected abstract Request buildRequest(ObjectNode body, GenerationOptions options, boolean streaming) throws IOException;

    protected abstract StreamDecoder newStreamDecoder();

    protected ObjectNode streamingBody(ObjectNode body) {
        return body;
    }

    protected RequestBody jsonBody(ObjectNode body) throws IOException {
        return RequestBody.create(mapper.writeValueAsString(body), JSON);
    }

    @Override
    protected ModelResponse send(ProviderRequest request, GenerationOptions options, CancellationSignal cancel) throws Exception {
        Call call = client.newCall(buildRequest(request.body(), options, false));
        try (CancellationSignal.Registration ignored = cancel.onCancel(call::cancel);
             Response response = call.execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw classifier.forStatus(Stage.REQUEST, response.code(), payload);
            }
            if (payload.isBlank()) {
                throw new UpstreamProtocolException(name, Stage.REQUEST, "empty response body");
            }
            return responseTranslator.translate(mapper.readTree(payload));
        }
    }

    @Override
    protected void openStream(
        ProviderRequest request,
        GenerationOptions options,
        StreamReassembler reassembler,
        CancellationSignal cancel
    ) throws Exception {
        Call call = client.newCall(buildRequest(streamingBody(request.body().deepCopy()), options, true));
        try (CancellationSignal.Registration ignored = cancel.onCancel(call::cancel);
             Response response = call.execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                throw classifier.forStatus(Stage.STREAM, response.code(), body == null ? "" : body.string());
            }
            if (body == null) {
                throw new UpstreamProtocolException(name, Stage.STREAM, "empty response body");
            }

            StreamDecoder decoder = newStreamDecoder();
            BufferedSource source = body.source();
            while (!source.exhausted()) {
                if (cancel.isCancelled()) {
                    reassembler.cancel();
                    throw new CancelledException(name, Stage.STREAM);
                }
                String line = source.readUtf8Line();
                if (line == null || !line.startsWith("data:")) {
                    continue;
                }
                String payload = line.substring(5).trim();
                if (payload.isEmpty()) {
                    continue;
                }
                if ("[DONE]".equals(payload)) {
                    break;
                }
                reassembler.acceptAll(decoder.decode(mapper.readTree(payload)));
            }
            reassembler.acceptAll(decoder.finish());
        }
    }
}
