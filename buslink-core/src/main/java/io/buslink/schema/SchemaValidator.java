package io.buslink.schema;

import io.buslink.BusConfig;
import io.buslink.SchemaValidationException;
import io.buslink.message.EventMessage;

/**
 * Validates event messages against the shared schema.
 *
 * <p>Both methods throw {@link SchemaValidationException} on mismatch. The client only
 * calls them when the API's {@code validateOutgoing} or {@code validateIncoming} setting
 * is on.
 */
public interface SchemaValidator {

    /** Accepts every message. */
    SchemaValidator NOOP = new SchemaValidator() {
        @Override
        public void validateOutgoing(BusConfig config, Schema schema, EventMessage message) {
        }

        @Override
        public void validateIncoming(BusConfig config, Schema schema, EventMessage message) {
        }
    };

    void validateOutgoing(BusConfig config, Schema schema, EventMessage message);

    void validateIncoming(BusConfig config, Schema schema, EventMessage message);
}
