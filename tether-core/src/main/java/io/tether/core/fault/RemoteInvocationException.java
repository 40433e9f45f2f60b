package io.tether.core.fault;

/**
 * Base class for failures reported by a remote client.
 *
 * @since 1.0.0
 */
public class RemoteInvocationException extends RuntimeException {

    public RemoteInvocationException(String message) {
        super(message);
    }

    public RemoteInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
