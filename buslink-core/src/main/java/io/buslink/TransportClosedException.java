package io.buslink;

/**
 * Thrown from a transport's consumption stream once the transport (or the consuming
 * thread) has been shut down. Consumers treat it as the normal end of a stream.
 */
public class TransportClosedException extends BusException {

    public TransportClosedException(String message) {
        super(message);
    }

    public TransportClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
