package io.buslink;

/**
 * Thrown when a transport is asked for a capability it does not implement.
 *
 * <p>Transport interfaces default every operation without a natural implementation to
 * this error, so a backend that supports only part of a role fails loudly instead of
 * silently doing nothing.
 */
public class UnsupportedTransportOperationException extends BusException {

    public UnsupportedTransportOperationException(String message) {
        super(message);
    }

    /**
     * Builds the standard error for {@code operation} on the given transport instance.
     *
     * @param transport the transport that lacks the capability
     * @param operation a short description of the operation, e.g. {@code "event history"}
     * @return the exception to throw
     */
    public static UnsupportedTransportOperationException of(Object transport, String operation) {
        return new UnsupportedTransportOperationException(
                "Transport " + transport.getClass().getSimpleName() + " does not support " + operation);
    }
}
