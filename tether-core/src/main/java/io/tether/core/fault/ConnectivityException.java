package io.tether.core.fault;

/**
 * Transport-level failure: the handshake failed, the channel dropped, the
 * endpoint is unreachable. Always retryable.
 *
 * @since 1.0.0
 */
public class ConnectivityException extends RemoteInvocationException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
