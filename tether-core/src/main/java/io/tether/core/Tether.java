package io.tether.core;

import io.tether.core.client.ClientFactory;
import io.tether.core.client.RemoteClient;
import io.tether.core.invoke.InvokerBuilder;

/**
 * Main entry point for building resilient invokers around stateful remote
 * clients.
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * InvokerChain<QuoteClient> quotes = Tether.invoker(QuoteClient.class, QuoteClient::new)
 *     .addLogging()
 *     .addResilience()
 *     .addCache(Duration.ofMinutes(5))
 *     .build();
 *
 * Quote quote = quotes.invoke(client -> client.latest("EUR/USD")).join();
 * }</pre>
 *
 * <p>Every call creates a fresh client, opens it, runs the operation and
 * closes the client again (aborting it if it faulted). Clients are never
 * shared between calls.</p>
 *
 * @since 1.0.0
 */
public final class Tether {

    /** Tether version */
    public static final String VERSION = "1.0.0-SNAPSHOT";

    private Tether() {
        // Static utility class
    }

    /**
     * Starts building an invoker for a client type.
     *
     * @param clientType the client type, used for cache keys and log lines
     * @param factory creates one fresh client per call
     * @param <C> client type
     * @return a single-use builder
     */
    public static <C extends RemoteClient> InvokerBuilder<C> invoker(Class<C> clientType, ClientFactory<C> factory) {
        return new InvokerBuilder<>(clientType, factory);
    }
}
