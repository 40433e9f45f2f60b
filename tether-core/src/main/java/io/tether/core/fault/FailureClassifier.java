package io.tether.core.fault;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a failure to a {@link FailureKind}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies the given failure.
     *
     * @param failure the failure, possibly wrapped in a
     *        {@link CompletionException} or {@link ExecutionException}
     * @return the failure kind, never null
     */
    FailureKind classify(Throwable failure);

    /**
     * Returns the standard classifier:
     * <ul>
     *   <li>{@link ConnectivityException}, {@link IOException} → CONNECTIVITY</li>
     *   <li>{@link TimeoutException} → TIMEOUT</li>
     *   <li>{@link RemoteFaultException} → CLIENT_FAULT or SERVER_FAULT by fault code</li>
     *   <li>{@link CancellationException} → CANCELLED</li>
     *   <li>anything else → UNCLASSIFIED</li>
     * </ul>
     */
    static FailureClassifier standard() {
        return failure -> {
            Throwable cause = unwrap(failure);
            if (cause instanceof RemoteFaultException) {
                return ((RemoteFaultException) cause).isClientFault()
                        ? FailureKind.CLIENT_FAULT
                        : FailureKind.SERVER_FAULT;
            }
            if (cause instanceof ConnectivityException || cause instanceof IOException) {
                return FailureKind.CONNECTIVITY;
            }
            if (cause instanceof TimeoutException) {
                return FailureKind.TIMEOUT;
            }
            if (cause instanceof CancellationException) {
                return FailureKind.CANCELLED;
            }
            return FailureKind.UNCLASSIFIED;
        };
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     *
     * @param failure the failure
     * @return the innermost meaningful cause
     */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
