package io.buslink;

/**
 * Base class for all errors raised by the bus client.
 *
 * <p>Configuration errors (unknown API, bad arguments, duplicate listener names and so on)
 * are raised synchronously to the caller and never retried. Failures inside background
 * tasks are not thrown at a caller; they are reported on the
 * {@link io.buslink.internal.ErrorChannel} instead.
 */
public class BusException extends RuntimeException {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
