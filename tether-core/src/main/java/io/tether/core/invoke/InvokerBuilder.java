package io.tether.core.invoke;

import io.tether.core.cache.CacheStore;
import io.tether.core.cache.CachingInvoker;
import io.tether.core.cache.InMemoryCacheStore;
import io.tether.core.client.ClientFactory;
import io.tether.core.client.RemoteClient;
import io.tether.core.logging.LoggingInvoker;
import io.tether.core.resilience.ResilientInvoker;
import io.tether.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-use builder assembling a decorator chain around a {@link BaseInvoker}.
 *
 * <p>Decorators wrap in the order they were added: the first one added is the
 * outermost layer and sees every call first.</p>
 *
 * <pre>{@code
 * Invoker<QuoteClient> invoker = new InvokerBuilder<>(QuoteClient.class, QuoteClient::new)
 *     .addLogging()                      // outermost: logs once per call
 *     .addResilience()                   // retries below the log
 *     .build();
 * }</pre>
 *
 * <p>Once {@link #build()} has run, every further call throws
 * {@link IllegalStateException}.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public class InvokerBuilder<C extends RemoteClient> {

    private static final Logger log = LoggerFactory.getLogger(InvokerBuilder.class);

    private final Class<C> clientType;
    private final ClientFactory<C> factory;
    private final List<InvokerDecorator<C>> decorators = new ArrayList<>();
    private boolean built;

    public InvokerBuilder(Class<C> clientType, ClientFactory<C> factory) {
        this.clientType = Objects.requireNonNull(clientType, "clientType must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Adds retry with the default policy: 3 attempts, backoff from 1 second,
     * 15 seconds per attempt.
     */
    public InvokerBuilder<C> addResilience() {
        return addResilience(RetryPolicy.defaults());
    }

    public InvokerBuilder<C> addResilience(RetryPolicy policy) {
        ensureNotBuilt();
        Objects.requireNonNull(policy, "policy must not be null");
        return add(inner -> new ResilientInvoker<>(inner, policy));
    }

    public InvokerBuilder<C> addLogging() {
        ensureNotBuilt();
        return add(inner -> new LoggingInvoker<>(inner, clientType));
    }

    /**
     * Adds result caching in the process-wide {@link InMemoryCacheStore#shared() shared store}.
     *
     * @param ttl absolute expiration of cached results
     */
    public InvokerBuilder<C> addCache(Duration ttl) {
        return addCache(ttl, InMemoryCacheStore.shared());
    }

    public InvokerBuilder<C> addCache(Duration ttl, CacheStore store) {
        ensureNotBuilt();
        Objects.requireNonNull(ttl, "ttl must not be null");
        Objects.requireNonNull(store, "store must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return add(inner -> new CachingInvoker<>(inner, clientType, store, ttl));
    }

    /**
     * Adds a custom decorator.
     */
    public InvokerBuilder<C> add(InvokerDecorator<C> decorator) {
        ensureNotBuilt();
        Objects.requireNonNull(decorator, "decorator must not be null");
        decorators.add(decorator);
        return this;
    }

    /**
     * Assembles the chain. May be called only once.
     *
     * @return the outermost invoker
     * @throws IllegalStateException if the builder was already used
     */
    public InvokerChain<C> build() {
        ensureNotBuilt();
        built = true;

        Invoker<C> current = new BaseInvoker<>(factory);
        List<String> layers = new ArrayList<>();
        layers.add(current.toString());

        for (int i = decorators.size() - 1; i >= 0; i--) {
            Invoker<C> decorated = decorators.get(i).decorate(current);
            if (decorated == null) {
                throw new IllegalStateException("Decorator #" + i + " returned null");
            }
            current = decorated;
            layers.add(0, layerName(decorated));
        }

        InvokerChain<C> chain = new InvokerChain<>(clientType, current, layers);
        log.debug("[TETHER] Built invoker for {}: {}", clientType.getSimpleName(), chain);
        return chain;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException(
                    "Invoker for " + clientType.getSimpleName() + " was already built");
        }
    }

    private static String layerName(Invoker<?> invoker) {
        String simpleName = invoker.getClass().getSimpleName();
        return simpleName.isEmpty() ? invoker.getClass().getName() : simpleName;
    }
}
