package io.tether.core.fault;

/**
 * Coarse classification of an invocation failure.
 *
 * @see FailureClassifier
 * @since 1.0.0
 */
public enum FailureKind {

    /** Handshake or transport failure */
    CONNECTIVITY(true),
    /** An attempt exceeded its deadline */
    TIMEOUT(true),
    /** Fault response not attributable to the caller's input */
    SERVER_FAULT(true),
    /** The remote side rejected the caller's input; retrying cannot help */
    CLIENT_FAULT(false),
    /** The caller cancelled the invocation */
    CANCELLED(false),
    /** Anything else, including configuration errors */
    UNCLASSIFIED(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Returns true if another attempt may succeed where this one failed.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
