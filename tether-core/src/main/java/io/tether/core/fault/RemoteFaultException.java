package io.tether.core.fault;

import java.util.Objects;

/**
 * Fault response returned by the remote service.
 *
 * <p>The {@link FaultCode} tells who is to blame: a {@code CLIENT} fault means
 * the request itself was rejected (malformed input, validation error) and is
 * never retried; a {@code SERVER} fault is treated as transient.</p>
 *
 * @since 1.0.0
 */
public class RemoteFaultException extends RemoteInvocationException {

    /**
     * Party responsible for the fault.
     */
    public enum FaultCode {
        /** The caller's request was invalid */
        CLIENT,
        /** The service failed to process a valid request */
        SERVER
    }

    private final FaultCode code;

    public RemoteFaultException(FaultCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public RemoteFaultException(FaultCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public static RemoteFaultException clientFault(String message) {
        return new RemoteFaultException(FaultCode.CLIENT, message);
    }

    public static RemoteFaultException serverFault(String message) {
        return new RemoteFaultException(FaultCode.SERVER, message);
    }

    public FaultCode getCode() {
        return code;
    }

    public boolean isClientFault() {
        return code == FaultCode.CLIENT;
    }
}
