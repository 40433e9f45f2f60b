package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

import java.util.concurrent.CompletionStage;

/**
 * Unit of work run against an open client, producing a result.
 *
 * @param <C> client type
 * @param <R> result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClientOperation<C extends RemoteClient, R> {

    /**
     * Runs the operation. A synchronous throw is treated exactly like a
     * failed stage.
     *
     * @param client an open client, owned by this call only
     * @return the pending result
     * @throws Exception if the operation cannot be started
     */
    CompletionStage<R> apply(C client) throws Exception;
}
