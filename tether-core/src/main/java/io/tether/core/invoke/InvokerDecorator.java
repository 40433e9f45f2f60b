package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

/**
 * Wraps an inner invoker with one cross-cutting behaviour.
 *
 * <pre>{@code
 * Tether.invoker(QuoteClient.class, QuoteClient::new)
 *     .add(inner -> new MetricsInvoker<>(inner, registry))
 *     .build();
 * }</pre>
 *
 * @param <C> client type
 * @since 1.0.0
 */
@FunctionalInterface
public interface InvokerDecorator<C extends RemoteClient> {

    /**
     * Returns an invoker delegating to {@code inner}.
     *
     * @param inner the next invoker towards the client
     * @return the decorated invoker, never null
     */
    Invoker<C> decorate(Invoker<C> inner);
}
