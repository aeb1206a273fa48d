package io.buslink;

/**
 * Thrown when a command reaches a handler that has no route for its type.
 */
public class UnsupportedCommandException extends BusException {

    public UnsupportedCommandException(String message) {
        super(message);
    }
}
