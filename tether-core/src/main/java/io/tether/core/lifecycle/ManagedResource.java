package io.tether.core.lifecycle;

/**
 * Resource whose stale entries can be released by {@link TetherResourceManager}.
 *
 * @since 1.0.0
 */
public interface ManagedResource {

    /**
     * Returns the unique name of this resource.
     */
    String name();

    /**
     * Returns the number of entries currently held.
     */
    long itemCount();

    /**
     * Releases every entry.
     * @return number of entries released
     */
    long releaseAll();

    /**
     * Releases expired entries only, keeping live data.
     * @return number of entries released
     */
    long releaseExpired();
}
