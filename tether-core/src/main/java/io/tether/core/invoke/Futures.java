package io.tether.core.invoke;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * Helpers shared by the invokers for wiring futures together.
 *
 * @since 1.0.0
 */
public final class Futures {

    private Futures() {
        // Static utility class
    }

    /**
     * Cancels {@code inner} when {@code outer} completes first, which happens
     * when a caller cancels or a timeout fires.
     */
    public static void cancelOnCompletion(CompletableFuture<?> outer, Future<?> inner) {
        outer.whenComplete((value, error) -> {
            if (!inner.isDone()) {
                inner.cancel(true);
            }
        });
    }

    /**
     * Runs an operation, turning a synchronous throw or a null stage into a
     * failed future.
     */
    static <T> CompletableFuture<T> start(StageSupplier<T> supplier) {
        try {
            CompletionStage<T> stage = supplier.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(
                        new NullPointerException("operation returned a null stage"));
            }
            return stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @FunctionalInterface
    interface StageSupplier<T> {
        CompletionStage<T> get() throws Exception;
    }
}
