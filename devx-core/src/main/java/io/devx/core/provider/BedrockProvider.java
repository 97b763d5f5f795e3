package io.devx.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.devx.core.client.ClientKey;
import io.devx.core.error.CancelledException;
import io.devx.core.error.ConfigException;
import io.devx.core.error.Stage;
import io.devx.core.error.UpstreamProtocolException;
import io.devx.core.model.GenerationOptions;
import io.devx.core.model.ModelResponse;
import io.devx.core.retry.CancellationSignal;
import io.devx.core.stream.StreamReassembler;
import io.devx.core.translate.AnthropicRequestTranslator;
import io.devx.core.translate.AnthropicResponseTranslator;
import io.devx.core.translate.AnthropicStreamDecoder;
import io.devx.core.translate.ProviderRequest;
import io.devx.core.translate.StreamDecoder;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelWithResponseStreamResponseHandler;

/**
 * Claude on Amazon Bedrock through {@code InvokeModel}, with an Anthropic Messages body. Both calls go through
 * the async client so a {@link CancellationSignal} can abort them mid-flight. Retries are left to the adapter's
 * retry executor, so the SDK client is built with SDK-level retries disabled.
 */
public final class BedrockProvider extends AbstractLlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(BedrockProvider.class);

    private final ObjectMapper mapper = new ObjectMapper();
    private final AnthropicResponseTranslator responseTranslator;
    private final Supplier<BedrockRuntimeAsyncClient> client;

    public BedrockProvider(String name, BedrockSettings settings, AdapterContext context) {
        this(
            name,
            context,
            () -> context.clientPool().get(key(name, settings), BedrockRuntimeAsyncClient.class, () -> buildClient(name, settings))
        );
    }

    BedrockProvider(String name, AdapterContext context, Supplier<BedrockRuntimeAsyncClient> client) {
        super(name, new AnthropicRequestTranslator(name, context.schemaCache(), context.repairer(), true), context.retryPolicy());
        this.responseTranslator = new AnthropicResponseTranslator(name);
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    @Override
    protected ModelResponse send(ProviderRequest request, GenerationOptions options, CancellationSignal cancel) throws Exception {
        String modelId = BedrockModels.resolve(options.model());
        LOG.debug("Invoking Bedrock model {}", modelId);
        CompletableFuture<InvokeModelResponse> future = client.get().invokeModel(InvokeModelRequest.builder()
            .modelId(modelId)
            .contentType("application/json")
            .accept("application/json")
            .body(SdkBytes.fromUtf8String(mapper.writeValueAsString(request.body())))
            .build());
        InvokeModelResponse response;
        try (CancellationSignal.Registration ignored = cancel.onCancel(() -> future.cancel(true))) {
            response = future.join();
        } catch (CancellationException e) {
            throw new CancelledException(name, Stage.REQUEST, e);
        }
        return responseTranslator.translate(mapper.readTree(response.body().asUtf8String()));
    }

    @Override
    protected void openStream(
        ProviderRequest request,
        GenerationOptions options,
        StreamReassembler reassembler,
        CancellationSignal cancel
    ) throws Exception {
        String modelId = BedrockModels.resolve(options.model());
        StreamDecoder decoder = new AnthropicStreamDecoder(name);
        InvokeModelWithResponseStreamRequest streamRequest = InvokeModelWithResponseStreamRequest.builder()
            .modelId(modelId)
            .contentType("application/json")
            .accept("application/json")
            .body(SdkBytes.fromUtf8String(mapper.writeValueAsString(request.body())))
            .build();

        InvokeModelWithResponseStreamResponseHandler handler = InvokeModelWithResponseStreamResponseHandler.builder()
            .subscriber(InvokeModelWithResponseStreamResponseHandler.Visitor.builder()
                .onChunk(part -> {
                    if (!cancel.isCancelled()) {
                        reassembler.acceptAll(decoder.decode(readChunk(part.bytes().asUtf8String())));
                    }
                })
                .build())
            .build();

        CompletableFuture<Void> future = client.get().invokeModelWithResponseStream(streamRequest, handler);
        try (CancellationSignal.Registration ignored = cancel.onCancel(() -> future.cancel(true))) {
            future.join();
        } catch (CancellationException e) {
            reassembler.cancel();
            throw new CancelledException(name, Stage.STREAM, e);
        }
        reassembler.acceptAll(decoder.finish());
    }

    private JsonNode readChunk(String json) {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UpstreamProtocolException(name, Stage.STREAM, "malformed stream chunk: " + e.getOriginalMessage(), e);
        }
    }

    private static ClientKey key(String name, BedrockSettings settings) {
        return ClientKey.of(name, settings.region() + "|" + settings.apiBase(), settings.credentialIdentity());
    }

    private static BedrockRuntimeAsyncClient buildClient(String name, BedrockSettings settings) {
        BedrockRuntimeAsyncClientBuilder builder = BedrockRuntimeAsyncClient.builder()
            .region(Region.of(region(name, settings)))
            .credentialsProvider(resolveCredentialsProvider(settings))
            .overrideConfiguration(noSdkRetries());
        if (!settings.apiBase().isBlank()) {
            builder.endpointOverride(URI.create(settings.apiBase()));
        }
        return builder.build();
    }

    @SuppressWarnings("deprecation")
    private static ClientOverrideConfiguration noSdkRetries() {
        return ClientOverrideConfiguration.builder()
            .retryPolicy(software.amazon.awssdk.core.retry.RetryPolicy.none())
            .build();
    }

    private static String region(String name, BedrockSettings settings) {
        String effective = firstNonBlank(settings.region(), System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (effective == null) {
            throw new ConfigException(name, "missing AWS region for Bedrock provider");
        }
        return effective;
    }

    private static AwsCredentialsProvider resolveCredentialsProvider(BedrockSettings settings) {
        if (!settings.accessKeyId().isBlank() && !settings.secretAccessKey().isBlank()) {
            if (!settings.sessionToken().isBlank()) {
                return StaticCredentialsProvider.create(
                    AwsSessionCredentials.create(settings.accessKeyId(), settings.secretAccessKey(), settings.sessionToken())
                );
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(settings.accessKeyId(), settings.secretAccessKey()));
        }
        if (!settings.profile().isBlank()) {
            return ProfileCredentialsProvider.create(settings.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
