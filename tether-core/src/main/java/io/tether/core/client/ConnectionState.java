package io.tether.core.client;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link RemoteClient} connection.
 *
 * <pre>
 *   CREATED ──► OPENING ──► OPENED ──► CLOSED
 *      │           │           │
 *      └───────────┴───────────┴──────► FAULTED
 * </pre>
 *
 * <p>{@code CREATED} and {@code OPENING} may also go straight to {@code CLOSED}
 * when the client is aborted before it was ever used. {@code CLOSED} and
 * {@code FAULTED} are terminal.</p>
 *
 * @since 1.0.0
 */
public enum ConnectionState {

    /** Returned by the factory, no handshake yet */
    CREATED,
    /** Handshake in progress */
    OPENING,
    /** Connection established, operations may run */
    OPENED,
    /** Gracefully closed or aborted before failure */
    CLOSED,
    /** Connection failed; the client can only be aborted */
    FAULTED;

    private Set<ConnectionState> successors;

    static {
        CREATED.successors = EnumSet.of(OPENING, CLOSED, FAULTED);
        OPENING.successors = EnumSet.of(OPENED, CLOSED, FAULTED);
        OPENED.successors = EnumSet.of(CLOSED, FAULTED);
        CLOSED.successors = EnumSet.noneOf(ConnectionState.class);
        FAULTED.successors = EnumSet.noneOf(ConnectionState.class);
    }

    /**
     * Returns true if a client in this state may move to {@code next}.
     *
     * @param next the target state
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(ConnectionState next) {
        return successors.contains(next);
    }

    /**
     * Returns true for {@link #CLOSED} and {@link #FAULTED}.
     */
    public boolean isTerminal() {
        return successors.isEmpty();
    }
}
