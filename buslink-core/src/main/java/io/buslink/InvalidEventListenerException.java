package io.buslink;

/**
 * Thrown when a listener handed to {@link io.buslink.client.EventClient#listen} cannot be invoked.
 */
public class InvalidEventListenerException extends BusException {

    public InvalidEventListenerException(String message) {
        super(message);
    }
}
