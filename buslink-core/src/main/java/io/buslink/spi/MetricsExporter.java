package io.buslink.spi;

/**
 * Observability hook for exporting bus client counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of commands placed on an internal queue.
     */
    void incrementCommandsSent();

    /**
     * Increments the count of commands whose handler returned normally.
     */
    void incrementCommandsCompleted();

    /**
     * Increments the count of commands whose handler threw.
     */
    void incrementCommandsFailed();

    /**
     * Increments the count of commands cancelled during shutdown.
     */
    default void incrementCommandsCancelled() {
    }

    /**
     * Records the depth of a command queue as last sampled by its monitor.
     *
     * @param channel the channel name (e.g. {@code "outbound"})
     * @param depth   number of queued commands
     */
    void recordQueueDepth(String channel, int depth);

    /**
     * Records how many handlers a consumer is currently running.
     *
     * @param channel the channel name
     * @param running number of in-flight handlers
     */
    default void recordRunningCommands(String channel, int running) {
    }

    /**
     * Increments the count of events fired by this client.
     */
    void incrementEventsFired();

    /**
     * Increments the count of events placed on a listener's intake queue.
     */
    void incrementEventsReceived();

    /**
     * Increments the count of events acknowledged after a listener completed.
     */
    default void incrementEventsAcknowledged() {
    }

    /**
     * Increments the count of inbound events dropped because no listener had the name.
     */
    default void incrementEventsDropped() {
    }

    /**
     * Increments the count of listener invocations that failed.
     */
    default void incrementListenerFailures() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementCommandsSent() {
        }

        @Override
        public void incrementCommandsCompleted() {
        }

        @Override
        public void incrementCommandsFailed() {
        }

        @Override
        public void recordQueueDepth(String channel, int depth) {
        }

        @Override
        public void incrementEventsFired() {
        }

        @Override
        public void incrementEventsReceived() {
        }
    }
}
