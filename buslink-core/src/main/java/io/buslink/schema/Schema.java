package io.buslink.schema;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to the shared schema of all known APIs.
 */
public interface Schema {

    /** A schema that knows no events. */
    Schema EMPTY = (apiName, eventName) -> Optional.empty();

    /**
     * Returns the schema document for one event.
     *
     * @param apiName   the API name
     * @param eventName the event name
     * @return the event's schema, or empty if none is known
     */
    Optional<Map<String, Object>> eventSchema(String apiName, String eventName);
}
