package io.tether.core.fault;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FailureClassifier")
class FailureClassifierTest {

    private final FailureClassifier classifier = FailureClassifier.standard();

    @Test
    @DisplayName("transport failures are connectivity failures")
    void connectivity() {
        assertThat(classifier.classify(new ConnectivityException("refused"))).isEqualTo(FailureKind.CONNECTIVITY);
        assertThat(classifier.classify(new ConnectException("refused"))).isEqualTo(FailureKind.CONNECTIVITY);
        assertThat(classifier.classify(new IOException("broken pipe"))).isEqualTo(FailureKind.CONNECTIVITY);
    }

    @Test
    @DisplayName("timeouts are retryable")
    void timeout() {
        FailureKind kind = classifier.classify(new TimeoutException());

        assertThat(kind).isEqualTo(FailureKind.TIMEOUT);
        assertThat(kind.isRetryable()).isTrue();
    }

    @Test
    @DisplayName("fault responses are split by fault code")
    void faultCodes() {
        assertThat(classifier.classify(RemoteFaultException.clientFault("bad sku")))
                .isEqualTo(FailureKind.CLIENT_FAULT);
        assertThat(classifier.classify(RemoteFaultException.serverFault("db down")))
                .isEqualTo(FailureKind.SERVER_FAULT);
        assertThat(FailureKind.CLIENT_FAULT.isRetryable()).isFalse();
        assertThat(FailureKind.SERVER_FAULT.isRetryable()).isTrue();
    }

    @Test
    @DisplayName("cancellation and unknown failures are not retryable")
    void notRetryable() {
        assertThat(classifier.classify(new CancellationException())).isEqualTo(FailureKind.CANCELLED);
        assertThat(classifier.classify(new IllegalArgumentException())).isEqualTo(FailureKind.UNCLASSIFIED);
        assertThat(FailureKind.CANCELLED.isRetryable()).isFalse();
        assertThat(FailureKind.UNCLASSIFIED.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("wrapped failures are classified by their cause")
    void wrapped() {
        RemoteFaultException fault = RemoteFaultException.clientFault("bad sku");
        Throwable wrapped = new CompletionException(new ExecutionException(fault));

        assertThat(FailureClassifier.unwrap(wrapped)).isSameAs(fault);
        assertThat(classifier.classify(wrapped)).isEqualTo(FailureKind.CLIENT_FAULT);
    }

    @Test
    @DisplayName("a wrapper without cause is kept as is")
    void wrapperWithoutCause() {
        CompletionException bare = new CompletionException("no cause", null);

        assertThat(FailureClassifier.unwrap(bare)).isSameAs(bare);
    }
}
