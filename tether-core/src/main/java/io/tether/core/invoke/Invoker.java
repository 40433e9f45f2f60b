package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Invokes operations on a remote client.
 *
 * <p>Decorate this interface to add cross-cutting behaviour (retry, caching,
 * logging). Every layer hands the operation down unchanged; only the side
 * effects differ.</p>
 *
 * <p>Failures are delivered as the exception the failing layer produced, never
 * wrapped: {@code future.get()} throws an {@code ExecutionException} whose
 * cause is that exception. Cancelling the returned future propagates down the
 * chain to the in-flight operation.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public interface Invoker<C extends RemoteClient> {

    /**
     * Invokes an operation and returns its result.
     *
     * @param operation the operation
     * @param <R> result type
     * @return the pending result
     */
    <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation);

    /**
     * Invokes an operation without a result.
     *
     * <p>Runs through {@link #invoke(ClientOperation)} with a {@code null} result.
     * Decorators pass it on as {@code run} instead, see {@link DecoratingInvoker}.</p>
     *
     * @param action the action
     * @return future completed when the action is done
     */
    default CompletableFuture<Void> run(ClientAction<C> action) {
        Objects.requireNonNull(action, "action must not be null");
        return this.<Void>invoke(client -> action.apply(client).thenApply(ignored -> (Void) null));
    }
}
