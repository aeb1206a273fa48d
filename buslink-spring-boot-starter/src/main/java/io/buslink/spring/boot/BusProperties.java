package io.buslink.spring.boot;

import io.buslink.BusConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the bus client.
 *
 * <pre>
 * buslink.queue-size-warning=10
 * buslink.default-api.cast-values=true
 * buslink.apis.shop.validate-incoming=false
 * buslink.metrics.name-prefix=orders.bus
 * </pre>
 *
 * @see BusAutoConfiguration
 */
@ConfigurationProperties(prefix = "buslink")
public class BusProperties {

    /**
     * Queue size at or above which the internal producers log warnings.
     */
    private int queueSizeWarning = 5;

    /**
     * How often the internal producers sample their queue, in milliseconds.
     */
    private long monitorIntervalMs = 100;

    /**
     * How long in-flight commands may finish on shutdown before they are cancelled.
     */
    private long consumerStopWaitMs = 1000;

    private final ApiSettings defaultApi = new ApiSettings();

    /**
     * Per-API overrides of {@code default-api}, keyed by API name.
     */
    private final Map<String, ApiSettings> apis = new LinkedHashMap<>();

    private final Schema schema = new Schema();
    private final Metrics metrics = new Metrics();

    public int getQueueSizeWarning() {
        return queueSizeWarning;
    }

    public void setQueueSizeWarning(int queueSizeWarning) {
        this.queueSizeWarning = queueSizeWarning;
    }

    public long getMonitorIntervalMs() {
        return monitorIntervalMs;
    }

    public void setMonitorIntervalMs(long monitorIntervalMs) {
        this.monitorIntervalMs = monitorIntervalMs;
    }

    public long getConsumerStopWaitMs() {
        return consumerStopWaitMs;
    }

    public void setConsumerStopWaitMs(long consumerStopWaitMs) {
        this.consumerStopWaitMs = consumerStopWaitMs;
    }

    public ApiSettings getDefaultApi() {
        return defaultApi;
    }

    public Map<String, ApiSettings> getApis() {
        return apis;
    }

    public Schema getSchema() {
        return schema;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Converts these properties into the core configuration object.
     *
     * @return a new {@link BusConfig}
     */
    public BusConfig toBusConfig() {
        BusConfig config = new BusConfig()
                .queueSizeWarning(queueSizeWarning)
                .monitorIntervalMs(monitorIntervalMs)
                .consumerStopWaitMs(consumerStopWaitMs)
                .defaultApi(defaultApi.toApiConfig())
                .schema(new BusConfig.SchemaConfig()
                        .ttlSeconds(schema.getTtlSeconds())
                        .pingIntervalSeconds(schema.getPingIntervalSeconds()));
        apis.forEach((name, settings) -> config.api(name, settings.toApiConfig()));
        return config;
    }

    public static class ApiSettings {
        private boolean castValues = true;
        private boolean validateOutgoing = true;
        private boolean validateIncoming = true;

        public boolean isCastValues() {
            return castValues;
        }

        public void setCastValues(boolean castValues) {
            this.castValues = castValues;
        }

        public boolean isValidateOutgoing() {
            return validateOutgoing;
        }

        public void setValidateOutgoing(boolean validateOutgoing) {
            this.validateOutgoing = validateOutgoing;
        }

        public boolean isValidateIncoming() {
            return validateIncoming;
        }

        public void setValidateIncoming(boolean validateIncoming) {
            this.validateIncoming = validateIncoming;
        }

        BusConfig.ApiConfig toApiConfig() {
            return new BusConfig.ApiConfig()
                    .castValues(castValues)
                    .validateOutgoing(validateOutgoing)
                    .validateIncoming(validateIncoming);
        }
    }

    public static class Schema {
        private int ttlSeconds = 60;
        private int pingIntervalSeconds = 20;

        public int getTtlSeconds() {
            return ttlSeconds;
        }

        public void setTtlSeconds(int ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
        }

        public int getPingIntervalSeconds() {
            return pingIntervalSeconds;
        }

        public void setPingIntervalSeconds(int pingIntervalSeconds) {
            this.pingIntervalSeconds = pingIntervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "buslink";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
