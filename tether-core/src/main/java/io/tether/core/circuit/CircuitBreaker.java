package io.tether.core.circuit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding calls to an auxiliary backend (e.g. a remote cache store).
 *
 * <ul>
 *   <li><b>CLOSED</b> - Normal operation, calls pass through</li>
 *   <li><b>OPEN</b> - Failure threshold reached, calls are rejected immediately</li>
 *   <li><b>HALF_OPEN</b> - Reset timeout elapsed, probing whether the backend recovered</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreaker.builder()
 *     .name("redis-store")
 *     .failureThreshold(5)
 *     .resetTimeout(Duration.ofSeconds(30))
 *     .build();
 *
 * Optional<Object> cached = breaker.executeOrThrow(() -> store.get(key));
 * }</pre>
 *
 * @since 1.0.0
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /**
     * Circuit breaker states.
     */
    public enum State {
        /** Normal operation - calls pass through */
        CLOSED,
        /** Failure threshold exceeded - calls rejected */
        OPEN,
        /** Testing recovery - calls allowed until a verdict */
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenSuccessThreshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private volatile Instant lastFailureTime;

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.halfOpenSuccessThreshold = builder.halfOpenSuccessThreshold;
        this.resetTimeout = builder.resetTimeout;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a circuit breaker with default settings (threshold=5, timeout=30s).
     */
    public static CircuitBreaker createDefault() {
        return builder().build();
    }

    /**
     * Executes the operation, or rejects it if the circuit is open.
     *
     * <p>Failures of the operation are recorded and rethrown unchanged.</p>
     *
     * @throws CircuitBreakerOpenException if the circuit is open
     */
    public <T> T executeOrThrow(Supplier<T> operation) {
        if (!allowRequest()) {
            throw new CircuitBreakerOpenException(name, state.get());
        }

        try {
            T result = operation.get();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure();
            throw e;
        }
    }

    /**
     * Returns true if a call may proceed. Moves OPEN to HALF_OPEN once the
     * reset timeout has elapsed.
     */
    public boolean allowRequest() {
        State currentState = state.get();

        if (currentState == State.CLOSED || currentState == State.HALF_OPEN) {
            return true;
        }

        Instant failedAt = lastFailureTime;
        if (failedAt != null && clock.instant().isAfter(failedAt.plus(resetTimeout))) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                failureCount.set(0);
                successCount.set(0);
                log.info("[TETHER] Circuit '{}' half-open, probing", name);
            }
            return true;
        }
        return false;
    }

    /**
     * Records a successful call.
     */
    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            if (successCount.incrementAndGet() >= halfOpenSuccessThreshold
                    && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                successCount.set(0);
                log.info("[TETHER] Circuit '{}' closed", name);
            }
        } else if (currentState == State.CLOSED) {
            failureCount.set(0);
        }
    }

    /**
     * Records a failed call.
     */
    public void recordFailure() {
        lastFailureTime = clock.instant();
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                log.warn("[TETHER] Circuit '{}' re-opened after failed probe", name);
            }
            return;
        }

        if (currentState == State.CLOSED
                && failureCount.incrementAndGet() >= failureThreshold
                && state.compareAndSet(State.CLOSED, State.OPEN)) {
            log.warn("[TETHER] Circuit '{}' opened after {} consecutive failures", name, failureThreshold);
        }
    }

    /**
     * Manually resets the circuit breaker to CLOSED.
     */
    public void reset() {
        state.set(State.CLOSED);
        failureCount.set(0);
        successCount.set(0);
        lastFailureTime = null;
    }

    public State getState() {
        return state.get();
    }

    public boolean isClosed() {
        return state.get() == State.CLOSED;
    }

    public boolean isOpen() {
        return state.get() == State.OPEN;
    }

    public String getName() {
        return name;
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    /**
     * Builder for CircuitBreaker.
     */
    public static class Builder {
        private String name = "default";
        private int failureThreshold = 5;
        private int halfOpenSuccessThreshold = 3;
        private Duration resetTimeout = Duration.ofSeconds(30);
        private Clock clock = Clock.systemUTC();

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder failureThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Failure threshold must be positive");
            }
            this.failureThreshold = threshold;
            return this;
        }

        /**
         * Sets how many successful probes close a half-open circuit (default 3).
         */
        public Builder halfOpenSuccessThreshold(int threshold) {
            if (threshold <= 0) {
                throw new IllegalArgumentException("Half-open success threshold must be positive");
            }
            this.halfOpenSuccessThreshold = threshold;
            return this;
        }

        public Builder resetTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Reset timeout must be positive");
            }
            this.resetTimeout = timeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }

    /**
     * Thrown when the circuit is open and a call is rejected.
     */
    public static class CircuitBreakerOpenException extends RuntimeException {
        private final String circuitName;
        private final State state;

        public CircuitBreakerOpenException(String circuitName, State state) {
            super("Circuit breaker '" + circuitName + "' is " + state);
            this.circuitName = circuitName;
            this.state = state;
        }

        public String getCircuitName() {
            return circuitName;
        }

        public State getState() {
            return state;
        }
    }
}
