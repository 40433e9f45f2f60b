package io.tether.core.cache;

import io.tether.core.client.RemoteClient;
import io.tether.core.fault.FailureClassifier;
import io.tether.core.invoke.ClientAction;
import io.tether.core.invoke.ClientOperation;
import io.tether.core.invoke.DecoratingInvoker;
import io.tether.core.invoke.Futures;
import io.tether.core.invoke.Invoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator returning a cached result instead of invoking the remote client.
 *
 * <p>The cache key is derived from the client type only
 * ({@code tether:cache:<SimpleName>}), so every value-returning operation of
 * the same client type shares one entry. Use it for clients exposing a single
 * idempotent query; two operations returning different types through the same
 * cached client type will fail with a {@link ClassCastException} at the call
 * site.</p>
 *
 * <p>Only successful, non-null results are stored, with absolute expiration
 * after the configured time-to-live and {@link CachePriority#HIGH} priority.
 * Failures are never cached. {@link #run(ClientAction)} bypasses the store
 * entirely.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public class CachingInvoker<C extends RemoteClient> extends DecoratingInvoker<C> {

    private static final Logger log = LoggerFactory.getLogger(CachingInvoker.class);

    static final String KEY_PREFIX = "tether:cache:";

    private final String clientName;
    private final String cacheKey;
    private final CacheStore store;
    private final Duration ttl;
    private final CacheEntryOptions entryOptions;

    public CachingInvoker(Invoker<C> delegate, Class<C> clientType, CacheStore store, Duration ttl) {
        super(delegate);
        Objects.requireNonNull(clientType, "clientType must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clientName = clientType.getSimpleName();
        this.cacheKey = cacheKeyFor(clientType);
        this.entryOptions = new CacheEntryOptions(ttl, CachePriority.HIGH, 1);
    }

    /**
     * Returns the cache key used for results of the given client type.
     */
    public static String cacheKeyFor(Class<?> clientType) {
        return KEY_PREFIX + clientType.getSimpleName();
    }

    @Override
    public <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation) {
        Optional<Object> cached;
        try {
            cached = store.get(cacheKey);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (cached.isPresent()) {
            log.debug("[TETHER] {} - cache hit for {}", clientName, cacheKey);
            @SuppressWarnings("unchecked")
            R value = (R) cached.get();
            return CompletableFuture.completedFuture(value);
        }

        log.debug("[TETHER] {} - cache miss for {}", clientName, cacheKey);
        CompletableFuture<R> call = delegate().invoke(operation);
        CompletableFuture<R> result = new CompletableFuture<>();

        call.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(FailureClassifier.unwrap(error));
                return;
            }
            if (value != null) {
                try {
                    store.set(cacheKey, value, entryOptions);
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                    return;
                }
                log.info("[TETHER] {} - result cached for {}", clientName, ttl);
            }
            result.complete(value);
        });
        Futures.cancelOnCompletion(result, call);
        return result;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public CacheStore getStore() {
        return store;
    }
}
