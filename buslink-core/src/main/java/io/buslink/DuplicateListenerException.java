package io.buslink;

/**
 * Thrown when a listener name is registered twice on the same client.
 */
public class DuplicateListenerException extends BusException {

    public DuplicateListenerException(String message) {
        super(message);
    }

    public static DuplicateListenerException named(String listenerName) {
        return new DuplicateListenerException("A listener with name '" + listenerName
                + "' is already registered. Listener names must be unique within a client.");
    }
}
