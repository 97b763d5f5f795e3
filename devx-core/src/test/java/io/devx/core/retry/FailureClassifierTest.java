package io.devx.core.retry;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.JsonParseException;
import io.devx.core.error.AdapterException;
import io.devx.core.error.ErrorKind;
import io.devx.core.error.Stage;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

class FailureClassifierTest {
    private final FailureClassifier classifier = new FailureClassifier("test");

    @Test
    void shouldMapHttpStatusCodes() {
        assertThat(classifier.forStatus(Stage.REQUEST, 401, "").kind()).isEqualTo(ErrorKind.AUTH);
        assertThat(classifier.forStatus(Stage.REQUEST, 403, "").kind()).isEqualTo(ErrorKind.AUTH);
        assertThat(classifier.forStatus(Stage.REQUEST, 429, "").kind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(classifier.forStatus(Stage.REQUEST, 503, "").kind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(classifier.forStatus(Stage.REQUEST, 400, "bad tool").kind()).isEqualTo(ErrorKind.REQUEST_REJECTED);
        assertThat(classifier.forStatus(Stage.REQUEST, 400, "bad tool").getMessage()).contains("bad tool");
    }

    @Test
    void shouldTreatIoFailuresAsTransient() {
        AdapterException classified = classifier.classify(new SocketTimeoutException("timeout"), Stage.STREAM);

        assertThat(classified.kind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(classified.stage()).isEqualTo(Stage.STREAM);
        assertThat(classifier.isRetryable(new IOException("reset"))).isTrue();
    }

    @Test
    void shouldTreatMalformedJsonAsProtocolError() {
        AdapterException classified = classifier.classify(new JsonParseException(null, "unexpected token"), Stage.REQUEST);

        assertThat(classified.kind()).isEqualTo(ErrorKind.UPSTREAM_PROTOCOL);
        assertThat(classified.retryable()).isFalse();
    }

    @Test
    void shouldUnwrapCompletionExceptions() {
        AdapterException classified = classifier.classify(
            new CompletionException(SdkClientException.create("unable to connect")),
            Stage.STREAM
        );

        assertThat(classified.kind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
    }

    @Test
    void shouldMapAwsServiceErrorsByStatus() {
        AwsServiceException throttled = AwsServiceException.builder().message("slow down").statusCode(429).build();
        AwsServiceException denied = AwsServiceException.builder().message("denied").statusCode(403).build();
        AwsServiceException invalid = AwsServiceException.builder().message("invalid").statusCode(400).build();

        assertThat(classifier.classify(throttled, Stage.REQUEST).kind()).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(classifier.classify(denied, Stage.REQUEST).kind()).isEqualTo(ErrorKind.AUTH);
        assertThat(classifier.classify(invalid, Stage.REQUEST).kind()).isEqualTo(ErrorKind.REQUEST_REJECTED);
    }
}
