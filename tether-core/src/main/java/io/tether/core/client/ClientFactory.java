package io.tether.core.client;

/**
 * Creates a brand-new {@link RemoteClient} on every call.
 *
 * <p>A faulted client is dead and cannot be reused, so every invocation
 * attempt (retries included) asks the factory for a fresh instance.
 * Implementations must not cache or pool clients.</p>
 *
 * @param <C> the client type
 * @since 1.0.0
 */
@FunctionalInterface
public interface ClientFactory<C extends RemoteClient> {

    /**
     * Creates a new client with no prior connection history.
     *
     * @return a new client in state {@link ConnectionState#CREATED}
     */
    C create();
}
