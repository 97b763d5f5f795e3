package io.devx.core.retry;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.devx.core.error.AdapterException;
import io.devx.core.error.AuthException;
import io.devx.core.error.RequestRejectedException;
import io.devx.core.error.Stage;
import io.devx.core.error.TransientNetworkException;
import io.devx.core.error.UpstreamProtocolException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

/**
 * Maps raw transport failures onto the adapter's error kinds. Only {@link TransientNetworkException}s are
 * worth another attempt.
 */
public final class FailureClassifier {
    private final String backend;

    public FailureClassifier(String backend) {
        this.backend = backend;
    }

    public boolean isRetryable(Throwable failure) {
        return classify(failure, Stage.REQUEST).retryable();
    }

    public AdapterException classify(Throwable failure, Stage stage) {
        Throwable error = unwrap(failure);
        if (error instanceof AdapterException adapterException) {
            return adapterException;
        }
        if (error instanceof JsonProcessingException json) {
            return new UpstreamProtocolException(backend, stage, "malformed response: " + json.getOriginalMessage(), json);
        }
        if (error instanceof IOException io) {
            return new TransientNetworkException(backend, stage, describe(io), io);
        }
        if (error instanceof AwsServiceException aws) {
            if (aws.isThrottlingException()) {
                return new TransientNetworkException(backend, stage, aws.statusCode(), describe(aws), aws);
            }
            return forStatus(stage, aws.statusCode(), describe(aws), aws);
        }
        if (error instanceof SdkClientException sdk) {
            return new TransientNetworkException(backend, stage, describe(sdk), sdk);
        }
        return new UpstreamProtocolException(backend, stage, describe(error), error);
    }

    public AdapterException forStatus(Stage stage, int statusCode, String body) {
        return forStatus(stage, statusCode, "HTTP " + statusCode + (body == null || body.isBlank() ? "" : " " + body), null);
    }

    public static boolean isTransientStatus(int statusCode) {
        return statusCode == 408 || statusCode == 425 || statusCode == 429 || statusCode >= 500;
    }

    private AdapterException forStatus(Stage stage, int statusCode, String detail, Throwable cause) {
        if (statusCode == 401 || statusCode == 403) {
            return new AuthException(backend, stage, detail, cause);
        }
        if (isTransientStatus(statusCode)) {
            return new TransientNetworkException(backend, stage, statusCode, detail, cause);
        }
        if (statusCode >= 400) {
            return new RequestRejectedException(backend, stage, detail, cause);
        }
        return new UpstreamProtocolException(backend, stage, detail, cause);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
