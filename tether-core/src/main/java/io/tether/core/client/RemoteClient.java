package io.tether.core.client;

import java.util.concurrent.CompletionStage;

/**
 * Handle to a stateful, connection-oriented remote service.
 *
 * <p>A client is created by a {@link ClientFactory}, used for exactly one
 * invocation attempt and then closed or aborted. Implementations are not
 * expected to be thread-safe beyond the guarantees of their state transitions:
 * a client is owned by a single in-flight call.</p>
 *
 * @see AbstractRemoteClient
 * @since 1.0.0
 */
public interface RemoteClient {

    /**
     * Returns the current connection state.
     * @return connection state
     */
    ConnectionState state();

    /**
     * Performs the connection handshake ({@code CREATED → OPENING → OPENED}).
     *
     * @return stage completed when the connection is open, or failed with the
     *         handshake error (the client is then {@link ConnectionState#FAULTED})
     */
    CompletionStage<Void> open();

    /**
     * Gracefully shuts the connection down ({@code OPENED → CLOSED}).
     *
     * @return stage completed when closed, or failed if the shutdown failed
     */
    CompletionStage<Void> close();

    /**
     * Tears the connection down immediately, releasing any resources.
     * Safe to call from any state, including {@link ConnectionState#FAULTED}.
     */
    void abort();
}
