package io.buslink;

/**
 * Thrown by a {@link io.buslink.schema.SchemaValidator} when a message does not match the shared schema.
 */
public class SchemaValidationException extends BusException {

    public SchemaValidationException(String message) {
        super(message);
    }
}
