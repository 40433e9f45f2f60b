package io.tether.core.invoke;

import io.tether.core.client.ClientFactory;
import io.tether.core.client.ConnectionState;
import io.tether.core.client.RemoteClient;
import io.tether.core.fault.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Innermost invoker: owns the connection lifecycle of a single call.
 *
 * <pre>
 *  factory.create() ──► open() ──► operation(client) ──► teardown ──► outcome
 *                                                          │
 *                    FAULTED ──► abort()                   │
 *                    OPENED  ──► close() ──(fails)──► abort()
 *                    OPENING ──► abort()   (cancelled mid-handshake)
 * </pre>
 *
 * <p>Every call creates exactly one client and tears it down before the
 * returned future completes. The outcome of the operation (or of the
 * handshake) is delivered unchanged; teardown failures are logged and never
 * replace it.</p>
 *
 * <p>If the returned future is completed from outside (caller cancellation,
 * resilience timeout) the in-flight stage is cancelled; teardown then runs
 * against whatever state the client is in at that moment.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public final class BaseInvoker<C extends RemoteClient> implements Invoker<C> {

    private static final Logger log = LoggerFactory.getLogger(BaseInvoker.class);

    private final ClientFactory<C> factory;

    public BaseInvoker(ClientFactory<C> factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override
    public <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");

        C client;
        try {
            client = factory.create();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (client == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Client factory returned null"));
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<Future<?>> inFlight = new AtomicReference<>();

        CompletableFuture<Void> opened = client.state() == ConnectionState.CREATED
                ? Futures.start(client::open)
                : CompletableFuture.completedFuture(null);
        inFlight.set(opened);

        CompletableFuture<R> completed = opened.thenCompose(ignored -> {
            CompletableFuture<R> running = Futures.start(() -> operation.apply(client));
            inFlight.set(running);
            if (result.isDone()) {
                running.cancel(true);
            }
            return running;
        });

        completed.whenComplete((value, error) ->
                teardown(client, error).whenComplete((ignored, teardownError) -> {
                    if (error != null) {
                        result.completeExceptionally(FailureClassifier.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                }));

        result.whenComplete((value, error) -> {
            if (!completed.isDone()) {
                Future<?> stage = inFlight.get();
                log.debug("[TETHER] Invocation completed externally, cancelling in-flight stage of {}", client);
                stage.cancel(true);
            }
        });

        return result;
    }

    private CompletableFuture<Void> teardown(C client, Throwable error) {
        ConnectionState state = client.state();

        if (state == ConnectionState.FAULTED) {
            abort(client);
            return CompletableFuture.completedFuture(null);
        }

        if (state == ConnectionState.OPENED) {
            return Futures.start(client::close).handle((ignored, closeError) -> {
                if (closeError != null) {
                    log.warn("[TETHER] Graceful close of {} failed, aborting: {}",
                            client, FailureClassifier.unwrap(closeError).toString());
                    abort(client);
                }
                return null;
            });
        }

        if (!state.isTerminal()) {
            log.debug("[TETHER] Aborting {} left in state {} (operation failed: {})",
                    client, state, error != null);
            abort(client);
        }
        return CompletableFuture.completedFuture(null);
    }

    private void abort(C client) {
        try {
            client.abort();
        } catch (RuntimeException e) {
            log.warn("[TETHER] Abort of {} failed: {}", client, e.toString());
        }
    }

    @Override
    public String toString() {
        return "BaseInvoker";
    }
}
