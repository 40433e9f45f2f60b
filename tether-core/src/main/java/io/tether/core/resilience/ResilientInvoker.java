package io.tether.core.resilience;

import io.tether.core.client.RemoteClient;
import io.tether.core.fault.FailureClassifier;
import io.tether.core.invoke.ClientAction;
import io.tether.core.invoke.ClientOperation;
import io.tether.core.invoke.DecoratingInvoker;
import io.tether.core.invoke.Invoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Decorator adding retry with exponential backoff and a per-attempt timeout.
 *
 * <p>Each attempt goes through the inner invoker, so every attempt runs on a
 * brand-new client. An attempt exceeding {@link RetryPolicy#attemptTimeout()}
 * fails with {@link java.util.concurrent.TimeoutException}, which also cancels
 * it so the base invoker tears its client down.</p>
 *
 * <p>Only failures the policy classifies as retryable are retried. When the
 * attempts are exhausted, or the failure is not retryable, the failure of the
 * last attempt is propagated unchanged.</p>
 *
 * <p>Backoff waits are scheduled, no thread is blocked between attempts.
 * Actions passed to {@link #run(ClientAction)} are retried the same way and
 * reach the inner invoker as {@code run}.</p>
 *
 * @param <C> client type
 * @since 1.0.0
 */
public class ResilientInvoker<C extends RemoteClient> extends DecoratingInvoker<C> {

    private static final Logger log = LoggerFactory.getLogger(ResilientInvoker.class);

    private final RetryPolicy policy;

    public ResilientInvoker(Invoker<C> delegate) {
        this(delegate, RetryPolicy.defaults());
    }

    public ResilientInvoker(Invoker<C> delegate, RetryPolicy policy) {
        super(delegate);
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public <R> CompletableFuture<R> invoke(ClientOperation<C, R> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        return retrying(() -> delegate().invoke(operation));
    }

    @Override
    public CompletableFuture<Void> run(ClientAction<C> action) {
        Objects.requireNonNull(action, "action must not be null");
        return retrying(() -> delegate().run(action));
    }

    private <R> CompletableFuture<R> retrying(Supplier<CompletableFuture<R>> call) {
        CompletableFuture<R> result = new CompletableFuture<>();
        AtomicReference<Future<?>> inFlight = new AtomicReference<>();

        result.whenComplete((value, error) -> {
            Future<?> pending = inFlight.get();
            if (pending != null && !pending.isDone()) {
                pending.cancel(true);
            }
        });

        attempt(call, 1, result, inFlight);
        return result;
    }

    private <R> void attempt(Supplier<CompletableFuture<R>> call, int attempt,
                             CompletableFuture<R> result, AtomicReference<Future<?>> inFlight) {
        if (result.isDone()) {
            return;
        }

        CompletableFuture<R> current;
        try {
            current = call.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }
        inFlight.set(current);
        if (result.isDone()) {
            current.cancel(true);
            return;
        }

        current.orTimeout(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error == null) {
                        result.complete(value);
                        return;
                    }

                    Throwable failure = FailureClassifier.unwrap(error);
                    if (result.isDone()) {
                        return;
                    }

                    if (attempt >= policy.maxAttempts() || !policy.isRetryable(failure)) {
                        if (attempt > 1) {
                            log.warn("[TETHER] Giving up after attempt {}/{}: {}",
                                    attempt, policy.maxAttempts(), failure.toString());
                        }
                        result.completeExceptionally(failure);
                        return;
                    }

                    Duration delay = policy.delayAfter(attempt);
                    log.warn("[TETHER] Attempt {}/{} failed ({}), retrying in {}ms",
                            attempt, policy.maxAttempts(), failure.toString(), delay.toMillis());

                    CompletableFuture<Void> backoff = CompletableFuture.runAsync(() -> { },
                            delayedExecutor(delay));
                    inFlight.set(backoff);
                    backoff.thenRun(() -> attempt(call, attempt + 1, result, inFlight));
                });
    }

    private static Executor delayedExecutor(Duration delay) {
        return CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Returns the retry policy of this invoker.
     */
    public RetryPolicy getPolicy() {
        return policy;
    }
}
