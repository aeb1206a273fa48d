package io.buslink;

/**
 * Thrown when an API does not declare the requested event.
 */
public class EventNotFoundException extends BusException {

    public EventNotFoundException(String message) {
        super(message);
    }
}
