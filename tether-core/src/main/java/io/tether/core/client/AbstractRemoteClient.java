package io.tether.core.client;

import io.tether.core.fault.FailureClassifier;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Skeleton {@link RemoteClient} that owns the connection state machine.
 *
 * <p>Subclasses implement the transport: {@link #doOpen()}, {@link #doClose()}
 * and {@link #doAbort()}. Every state change goes through
 * {@link #transition(ConnectionState, ConnectionState)}, so an illegal move
 * (closing a faulted client, opening twice) fails with
 * {@link IllegalStateException} instead of silently corrupting the state.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * class InventoryClient extends AbstractRemoteClient {
 *     protected CompletionStage<Void> doOpen() { return channel.connect(); }
 *     protected CompletionStage<Void> doClose() { return channel.shutdown(); }
 *     protected void doAbort() { channel.shutdownNow(); }
 *
 *     CompletionStage<Stock> stock(String sku) {
 *         return channel.call("stock", sku).whenComplete((r, e) -> {
 *             if (e != null && isTransportFailure(e)) {
 *                 markFaulted();
 *             }
 *         });
 *     }
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public abstract class AbstractRemoteClient implements RemoteClient {

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CREATED);
    private final AtomicBoolean aborted = new AtomicBoolean(false);

    @Override
    public final ConnectionState state() {
        return state.get();
    }

    @Override
    public final CompletionStage<Void> open() {
        transition(ConnectionState.CREATED, ConnectionState.OPENING);

        CompletionStage<Void> handshake;
        try {
            handshake = doOpen();
        } catch (RuntimeException e) {
            markFaulted();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> opened = new CompletableFuture<>();
        handshake.whenComplete((ignored, error) -> {
            if (error != null) {
                markFaulted();
                opened.completeExceptionally(FailureClassifier.unwrap(error));
            } else if (state.compareAndSet(ConnectionState.OPENING, ConnectionState.OPENED)) {
                opened.complete(null);
            } else {
                // aborted while the handshake was in flight
                opened.completeExceptionally(new IllegalStateException(
                        "Client was " + state.get() + " before the handshake completed"));
            }
        });
        return opened;
    }

    @Override
    public final CompletionStage<Void> close() {
        ConnectionState current = state.get();
        if (current != ConnectionState.OPENED) {
            throw new IllegalStateException("Cannot close a client in state " + current);
        }

        CompletionStage<Void> shutdown;
        try {
            shutdown = doClose();
        } catch (RuntimeException e) {
            markFaulted();
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Void> closed = new CompletableFuture<>();
        shutdown.whenComplete((ignored, error) -> {
            if (error != null) {
                markFaulted();
                closed.completeExceptionally(FailureClassifier.unwrap(error));
            } else {
                state.compareAndSet(ConnectionState.OPENED, ConnectionState.CLOSED);
                closed.complete(null);
            }
        });
        return closed;
    }

    @Override
    public final void abort() {
        state.updateAndGet(s -> s == ConnectionState.FAULTED ? s : ConnectionState.CLOSED);
        if (aborted.compareAndSet(false, true)) {
            doAbort();
        }
    }

    /**
     * Returns true once {@link #abort()} has released the transport.
     */
    public final boolean isAborted() {
        return aborted.get();
    }

    /**
     * Moves the client to {@link ConnectionState#FAULTED} from any non-terminal
     * state. Subclasses call this when the transport breaks mid-operation.
     *
     * @return true if the state changed
     */
    protected final boolean markFaulted() {
        ConnectionState previous = state.getAndUpdate(s -> s.isTerminal() ? s : ConnectionState.FAULTED);
        return !previous.isTerminal();
    }

    /**
     * Atomically moves from {@code expected} to {@code next}.
     *
     * @throws IllegalStateException if the transition is not legal or the
     *         client is not in the expected state
     */
    protected final void transition(ConnectionState expected, ConnectionState next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + expected + " -> " + next);
        }
        if (!state.compareAndSet(expected, next)) {
            throw new IllegalStateException(
                    "Cannot move client to " + next + ": expected " + expected + " but was " + state.get());
        }
    }

    /**
     * Performs the transport handshake.
     */
    protected abstract CompletionStage<Void> doOpen();

    /**
     * Performs the graceful transport shutdown.
     */
    protected abstract CompletionStage<Void> doClose();

    /**
     * Releases the transport immediately. Must not throw.
     */
    protected abstract void doAbort();
}
