package io.tether.core.invoke;

import io.tether.core.client.RemoteClient;

import java.util.concurrent.CompletionStage;

/**
 * Unit of work run against an open client for its side effects only.
 *
 * @param <C> client type
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClientAction<C extends RemoteClient> {

    /**
     * Runs the action.
     *
     * @param client an open client, owned by this call only
     * @return stage completed when the action is done; its value is ignored
     * @throws Exception if the action cannot be started
     */
    CompletionStage<?> apply(C client) throws Exception;
}
