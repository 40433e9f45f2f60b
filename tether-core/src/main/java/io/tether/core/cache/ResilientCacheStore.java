package io.tether.core.cache;

import io.tether.core.circuit.CircuitBreaker;
import io.tether.core.circuit.CircuitBreaker.CircuitBreakerOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CacheStore} wrapper that degrades gracefully when the backing store
 * fails.
 *
 * <p>Every operation goes through a {@link CircuitBreaker}. A failing or
 * rejected read is reported as a miss and a failing or rejected write is
 * skipped, so an unavailable store only costs the caller a remote call.</p>
 *
 * <pre>{@code
 * CacheStore store = new ResilientCacheStore(redisStore);
 * Tether.invoker(QuoteClient.class, QuoteClient::new)
 *     .addCache(Duration.ofMinutes(5), store)
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public class ResilientCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(ResilientCacheStore.class);

    private final CacheStore delegate;
    private final CircuitBreaker circuitBreaker;

    /**
     * Wraps a store with a circuit breaker opening after 5 consecutive
     * failures and probing again after 30 seconds.
     */
    public ResilientCacheStore(CacheStore delegate) {
        this(delegate, CircuitBreaker.builder()
                .name("cache-store:" + Objects.requireNonNull(delegate, "delegate must not be null").name())
                .failureThreshold(5)
                .resetTimeout(Duration.ofSeconds(30))
                .build());
    }

    public ResilientCacheStore(CacheStore delegate, CircuitBreaker circuitBreaker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker must not be null");
    }

    @Override
    public Optional<Object> get(String key) {
        try {
            return circuitBreaker.executeOrThrow(() -> delegate.get(key));
        } catch (CircuitBreakerOpenException e) {
            log.debug("[TETHER] {} - circuit open, treating get({}) as a miss", delegate.name(), key);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[TETHER] {} - get({}) failed, treating as a miss: {}", delegate.name(), key, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean contains(String key) {
        try {
            return circuitBreaker.executeOrThrow(() -> delegate.contains(key));
        } catch (CircuitBreakerOpenException e) {
            log.debug("[TETHER] {} - circuit open, contains({}) is false", delegate.name(), key);
            return false;
        } catch (RuntimeException e) {
            log.warn("[TETHER] {} - contains({}) failed: {}", delegate.name(), key, e.toString());
            return false;
        }
    }

    @Override
    public void set(String key, Object value, CacheEntryOptions options) {
        try {
            circuitBreaker.executeOrThrow(() -> {
                delegate.set(key, value, options);
                return null;
            });
        } catch (CircuitBreakerOpenException e) {
            log.debug("[TETHER] {} - circuit open, skipping set({})", delegate.name(), key);
        } catch (RuntimeException e) {
            log.warn("[TETHER] {} - set({}) failed, entry not cached: {}", delegate.name(), key, e.toString());
        }
    }

    @Override
    public void remove(String key) {
        try {
            circuitBreaker.executeOrThrow(() -> {
                delegate.remove(key);
                return null;
            });
        } catch (CircuitBreakerOpenException e) {
            log.debug("[TETHER] {} - circuit open, skipping remove({})", delegate.name(), key);
        } catch (RuntimeException e) {
            log.warn("[TETHER] {} - remove({}) failed: {}", delegate.name(), key, e.toString());
        }
    }

    @Override
    public String name() {
        return delegate.name();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
