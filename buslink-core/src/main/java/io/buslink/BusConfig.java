package io.buslink;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-wide settings for a bus client.
 *
 * <p>Plain mutable configuration with fluent setters. Build it once at startup and treat
 * it as read-only after the client has been created.
 *
 * <pre>{@code
 * BusConfig config = new BusConfig()
 *     .queueSizeWarning(10)
 *     .api("shop", new BusConfig.ApiConfig().castValues(false));
 * }</pre>
 */
public final class BusConfig {

    private int queueSizeWarning = 5;
    private long monitorIntervalMs = 100;
    private long consumerStopWaitMs = 1000;
    private ApiConfig defaultApi = new ApiConfig();
    private final Map<String, ApiConfig> apis = new LinkedHashMap<>();
    private SchemaConfig schema = new SchemaConfig();

    public int getQueueSizeWarning() {
        return queueSizeWarning;
    }

    /**
     * Queue size at or above which producers log warnings. Defaults to {@code 5}.
     *
     * @param queueSizeWarning warning threshold, must be &ge; 1
     * @return this config
     */
    public BusConfig queueSizeWarning(int queueSizeWarning) {
        if (queueSizeWarning < 1) {
            throw new IllegalArgumentException("queueSizeWarning must be >= 1");
        }
        this.queueSizeWarning = queueSizeWarning;
        return this;
    }

    public long getMonitorIntervalMs() {
        return monitorIntervalMs;
    }

    /**
     * How often producers sample their queue. Defaults to {@code 100} ms.
     *
     * @param monitorIntervalMs poll interval, must be &gt; 0
     * @return this config
     */
    public BusConfig monitorIntervalMs(long monitorIntervalMs) {
        if (monitorIntervalMs <= 0) {
            throw new IllegalArgumentException("monitorIntervalMs must be > 0");
        }
        this.monitorIntervalMs = monitorIntervalMs;
        return this;
    }

    public long getConsumerStopWaitMs() {
        return consumerStopWaitMs;
    }

    /**
     * How long consumers let in-flight commands finish on stop. Defaults to {@code 1000} ms.
     *
     * @param consumerStopWaitMs drain window, must be &ge; 0
     * @return this config
     */
    public BusConfig consumerStopWaitMs(long consumerStopWaitMs) {
        if (consumerStopWaitMs < 0) {
            throw new IllegalArgumentException("consumerStopWaitMs must be >= 0");
        }
        this.consumerStopWaitMs = consumerStopWaitMs;
        return this;
    }

    public ApiConfig getDefaultApi() {
        return defaultApi;
    }

    public BusConfig defaultApi(ApiConfig defaultApi) {
        this.defaultApi = Objects.requireNonNull(defaultApi, "defaultApi");
        return this;
    }

    /**
     * Overrides the settings of one API.
     *
     * @param apiName   the API name
     * @param apiConfig settings for that API
     * @return this config
     */
    public BusConfig api(String apiName, ApiConfig apiConfig) {
        apis.put(Objects.requireNonNull(apiName, "apiName"), Objects.requireNonNull(apiConfig, "apiConfig"));
        return this;
    }

    /**
     * Returns the settings for an API, falling back to the default settings.
     *
     * @param apiName the API name
     * @return the override for {@code apiName}, or the default
     */
    public ApiConfig api(String apiName) {
        return apis.getOrDefault(apiName, defaultApi);
    }

    public Map<String, ApiConfig> getApis() {
        return Collections.unmodifiableMap(apis);
    }

    public SchemaConfig getSchema() {
        return schema;
    }

    public BusConfig schema(SchemaConfig schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
        return this;
    }

    /** Per-API settings. */
    public static final class ApiConfig {
        private boolean castValues = true;
        private boolean validateOutgoing = true;
        private boolean validateIncoming = true;

        public boolean isCastValues() {
            return castValues;
        }

        /**
         * Whether incoming kwargs are cast to the listener's declared parameter types.
         * Defaults to {@code true}.
         */
        public ApiConfig castValues(boolean castValues) {
            this.castValues = castValues;
            return this;
        }

        public boolean isValidateOutgoing() {
            return validateOutgoing;
        }

        public ApiConfig validateOutgoing(boolean validateOutgoing) {
            this.validateOutgoing = validateOutgoing;
            return this;
        }

        public boolean isValidateIncoming() {
            return validateIncoming;
        }

        public ApiConfig validateIncoming(boolean validateIncoming) {
            this.validateIncoming = validateIncoming;
            return this;
        }
    }

    /** Settings of the schema transport. */
    public static final class SchemaConfig {
        private int ttlSeconds = 60;
        private int pingIntervalSeconds = 20;

        public int getTtlSeconds() {
            return ttlSeconds;
        }

        public SchemaConfig ttlSeconds(int ttlSeconds) {
            if (ttlSeconds < 1) {
                throw new IllegalArgumentException("ttlSeconds must be >= 1");
            }
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public int getPingIntervalSeconds() {
            return pingIntervalSeconds;
        }

        public SchemaConfig pingIntervalSeconds(int pingIntervalSeconds) {
            if (pingIntervalSeconds < 1) {
                throw new IllegalArgumentException("pingIntervalSeconds must be >= 1");
            }
            this.pingIntervalSeconds = pingIntervalSeconds;
            return this;
        }
    }
}
