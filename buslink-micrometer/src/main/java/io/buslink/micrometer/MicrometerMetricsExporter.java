package io.buslink.micrometer;

import io.buslink.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code buslink.commands.sent}: commands placed on an internal queue</li>
 *   <li>{@code buslink.commands.completed}: command handlers that returned normally</li>
 *   <li>{@code buslink.commands.failed}: command handlers that threw</li>
 *   <li>{@code buslink.commands.cancelled}: command handlers cancelled on shutdown</li>
 *   <li>{@code buslink.events.fired}: events fired by this client</li>
 *   <li>{@code buslink.events.received}: events placed on a listener's intake queue</li>
 *   <li>{@code buslink.events.acknowledged}: events acknowledged after their listener ran</li>
 *   <li>{@code buslink.events.dropped}: events for unknown listeners</li>
 *   <li>{@code buslink.listener.failures}: listener invocations that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <p>Tagged with {@code channel} (e.g. {@code outbound}, {@code inbound}) and registered
 * the first time a channel reports.
 * <ul>
 *   <li>{@code buslink.queue.depth}: commands waiting on the channel's queue</li>
 *   <li>{@code buslink.commands.running}: handlers currently running on the channel</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter commandsSent;
    private final Counter commandsCompleted;
    private final Counter commandsFailed;
    private final Counter commandsCancelled;
    private final Counter eventsFired;
    private final Counter eventsReceived;
    private final Counter eventsAcknowledged;
    private final Counter eventsDropped;
    private final Counter listenerFailures;

    private final Map<String, AtomicInteger> queueDepths = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> runningCommands = new ConcurrentHashMap<>();
    private final List<Meter> gauges = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "buslink"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "buslink");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-client use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.bus"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.namePrefix = namePrefix;
        this.commandsSent = counter("commands.sent", "Commands placed on an internal queue");
        this.commandsCompleted = counter("commands.completed", "Command handlers that returned normally");
        this.commandsFailed = counter("commands.failed", "Command handlers that threw");
        this.commandsCancelled = counter("commands.cancelled", "Command handlers cancelled on shutdown");
        this.eventsFired = counter("events.fired", "Events fired by this client");
        this.eventsReceived = counter("events.received", "Events placed on a listener's intake queue");
        this.eventsAcknowledged = counter("events.acknowledged", "Events acknowledged after processing");
        this.eventsDropped = counter("events.dropped", "Events received for unknown listeners");
        this.listenerFailures = counter("listener.failures", "Listener invocations that threw");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(namePrefix + "." + name)
                .description(description)
                .register(registry);
    }

    private AtomicInteger channelGauge(Map<String, AtomicInteger> values, String name, String channel) {
        return values.computeIfAbsent(channel, key -> {
            AtomicInteger value = new AtomicInteger();
            gauges.add(Gauge.builder(namePrefix + "." + name, value, AtomicInteger::get)
                    .tag("channel", key)
                    .register(registry));
            return value;
        });
    }

    @Override
    public void incrementCommandsSent() {
        if (closed) return;
        commandsSent.increment();
    }

    @Override
    public void incrementCommandsCompleted() {
        if (closed) return;
        commandsCompleted.increment();
    }

    @Override
    public void incrementCommandsFailed() {
        if (closed) return;
        commandsFailed.increment();
    }

    @Override
    public void incrementCommandsCancelled() {
        if (closed) return;
        commandsCancelled.increment();
    }

    @Override
    public void recordQueueDepth(String channel, int depth) {
        if (closed) return;
        channelGauge(queueDepths, "queue.depth", channel).set(depth);
    }

    @Override
    public void recordRunningCommands(String channel, int running) {
        if (closed) return;
        channelGauge(runningCommands, "commands.running", channel).set(running);
    }

    @Override
    public void incrementEventsFired() {
        if (closed) return;
        eventsFired.increment();
    }

    @Override
    public void incrementEventsReceived() {
        if (closed) return;
        eventsReceived.increment();
    }

    @Override
    public void incrementEventsAcknowledged() {
        if (closed) return;
        eventsAcknowledged.increment();
    }

    @Override
    public void incrementEventsDropped() {
        if (closed) return;
        eventsDropped.increment();
    }

    @Override
    public void incrementListenerFailures() {
        if (closed) return;
        listenerFailures.increment();
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Called by {@link io.buslink.BusClient#close()} to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(commandsSent, commandsCompleted, commandsFailed,
                commandsCancelled, eventsFired, eventsReceived, eventsAcknowledged, eventsDropped,
                listenerFailures));
        meters.addAll(gauges);
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
