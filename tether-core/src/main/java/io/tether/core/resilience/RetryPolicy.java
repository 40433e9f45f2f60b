package io.tether.core.resilience;

import io.tether.core.fault.FailureClassifier;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable retry configuration for {@link ResilientInvoker}.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(3)                       // 1 initial + 2 retries
 *     .baseDelay(Duration.ofSeconds(1))     // 1s, 2s, 4s, ...
 *     .attemptTimeout(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 *
 * @param maxAttempts total number of attempts, including the first one
 * @param baseDelay delay before the first retry; doubles for every further retry
 * @param attemptTimeout deadline of a single attempt
 * @param classifier decides which failures are retryable
 *
 * @since 1.0.0
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration attemptTimeout,
        FailureClassifier classifier
) {

    /** Default attempts: 3 in total. */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** Default base delay: 1 second. */
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    /** Default per-attempt timeout: 15 seconds. */
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(15);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
        Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Returns the default policy: 3 attempts, 1s exponential backoff, 15s per attempt.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns true if {@code failure} is retryable under this policy.
     */
    public boolean isRetryable(Throwable failure) {
        return classifier.classify(failure).isRetryable();
    }

    /**
     * Returns the delay to wait after the given failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return {@code baseDelay * 2^(failedAttempt - 1)}
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException("failedAttempt must be positive");
        }
        int shift = Math.min(failedAttempt - 1, 30);
        return baseDelay.multipliedBy(1L << shift);
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration attemptTimeout = DEFAULT_ATTEMPT_TIMEOUT;
        private FailureClassifier classifier = FailureClassifier.standard();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /**
         * Replaces the standard classifier, e.g. to map a vendor SDK's
         * exceptions onto failure kinds.
         */
        public Builder classifier(FailureClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, baseDelay, attemptTimeout, classifier);
        }
    }
}
