package io.buslink.transport;

import io.buslink.UnsupportedTransportOperationException;

import java.util.Map;

/**
 * Shares API schemas between processes. Stored schemas expire unless pinged.
 */
public interface SchemaTransport extends Transport {

    /**
     * Stores the schema for an API.
     *
     * @param apiName    the API name
     * @param schema     the schema document
     * @param ttlSeconds seconds until the schema expires
     * @throws Exception if storing fails
     */
    default void store(String apiName, Map<String, Object> schema, int ttlSeconds) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "storing schemas");
    }

    /**
     * Keeps a stored schema alive. Defaults to storing it again, which refreshes the expiry.
     *
     * @param apiName    the API name
     * @param schema     the schema document
     * @param ttlSeconds seconds until the schema expires
     * @throws Exception if the refresh fails
     */
    default void ping(String apiName, Map<String, Object> schema, int ttlSeconds) throws Exception {
        store(apiName, schema, ttlSeconds);
    }

    /**
     * Loads all current schemas.
     *
     * @return schema documents keyed by API name
     * @throws Exception if loading fails
     */
    default Map<String, Map<String, Object>> load() throws Exception {
        throw UnsupportedTransportOperationException.of(this, "loading schemas");
    }
}
