package io.buslink;

/**
 * Thrown when an API, event or procedure name does not have a valid syntax.
 */
public class InvalidNameException extends BusException {

    public InvalidNameException(String message) {
        super(message);
    }
}
