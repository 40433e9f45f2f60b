package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Immutable invoker chain produced by {@link InvokerBuilder}.
 *
 * @param <C> client type
 * @since 1.0.0
 */
public final class InvokerChain<C extends RemoteClient> implements Invoker<C> {

    private final Class<C> clientType;
    private final Invoker<C> head;
    private final List<String> layers;

    InvokerChain(Class<C> clientType, Invoker<C> head, List<String> layers) {
        this.clientType = Objects.requireNonNull(clientType, "clientType must not be null");
        this.head = Objects.requireNonNull(head, "head must not be null");
        this.layers = List.copyOf(layers);
    }

    @Override
    public <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation) {
        return head.invoke(operation);
    }

    @Override
    public CompletableFuture<Void> run(ClientAction<C> action) {
        return head.run(action);
    }

    /**
     * Returns the layer names, outermost first. The last one is always
     * {@code BaseInvoker}.
     */
    public List<String> layers() {
        return layers;
    }

    public Class<C> clientType() {
        return clientType;
    }

    @Override
    public String toString() {
        return clientType.getSimpleName() + " [" + String.join(" -> ", layers) + "]";
    }
}
