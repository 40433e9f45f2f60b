package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for invokers that wrap exactly one inner invoker.
 *
 * <p>{@link #run(ClientAction)} is handed down as {@code run}, never turned
 * into an {@code invoke}, so layers below can tell calls without a result
 * apart (a caching layer must not answer them). Subclasses that add
 * behaviour to every call override both methods.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public abstract class DecoratingInvoker<C extends RemoteClient> implements Invoker<C> {

    private final Invoker<C> delegate;

    protected DecoratingInvoker(Invoker<C> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    /**
     * Returns the invoker being decorated.
     */
    protected final Invoker<C> delegate() {
        return delegate;
    }

    @Override
    public CompletableFuture<Void> run(ClientAction<C> action) {
        return delegate.run(action);
    }

    @Override
    public String toString() {
        String simpleName = getClass().getSimpleName();
        String name = simpleName.isEmpty() ? getClass().getName() : simpleName;
        return name + '(' + delegate + ')';
    }
}
