package io.tether.core.logging;

import io.tether.core.client.RemoteClient;
import io.tether.core.fault.FailureClassifier;
import io.tether.core.invoke.ClientAction;
import io.tether.core.invoke.ClientOperation;
import io.tether.core.invoke.DecoratingInvoker;
import io.tether.core.invoke.Futures;
import io.tether.core.invoke.Invoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Decorator logging the start, completion and failure of every invocation.
 *
 * <p>Logs {@code "<client> - invoking"} before delegating, then either
 * {@code "<client> - completed in Nms"} or {@code "<client> - failed after Nms"}
 * with the exception. The outcome is passed through untouched.</p>
 *
 * <p>When an outer layer completes the call first (a retry timeout, a caller
 * cancellation), the failure line carries that outcome, not the cancellation
 * it causes below.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public class LoggingInvoker<C extends RemoteClient> extends DecoratingInvoker<C> {

    private static final Logger log = LoggerFactory.getLogger(LoggingInvoker.class);

    private final String clientName;

    public LoggingInvoker(Invoker<C> delegate, Class<C> clientType) {
        super(delegate);
        this.clientName = Objects.requireNonNull(clientType, "clientType must not be null").getSimpleName();
    }

    @Override
    public <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation) {
        return observe(() -> delegate().invoke(operation));
    }

    @Override
    public CompletableFuture<Void> run(ClientAction<C> action) {
        return observe(() -> delegate().run(action));
    }

    private <R> CompletableFuture<R> observe(Supplier<CompletableFuture<R>> invocation) {
        log.info("[TETHER] {} - invoking", clientName);
        long start = System.nanoTime();

        CompletableFuture<R> call;
        try {
            call = invocation.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicBoolean logged = new AtomicBoolean();

        // log before completing result
        call.whenComplete((value, error) -> {
            if (result.isDone()) {
                return;
            }
            if (logged.compareAndSet(false, true)) {
                logOutcome(start, error);
            }
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(FailureClassifier.unwrap(error));
            }
        });

        // completed from outside
        result.whenComplete((value, error) -> {
            if (logged.compareAndSet(false, true)) {
                logOutcome(start, error);
            }
        });

        Futures.cancelOnCompletion(result, call);
        return result;
    }

    private void logOutcome(long start, Throwable error) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        if (error == null) {
            log.info("[TETHER] {} - completed in {}ms", clientName, elapsedMs);
        } else {
            log.error("[TETHER] {} - failed after {}ms", clientName, elapsedMs, FailureClassifier.unwrap(error));
        }
    }
}
