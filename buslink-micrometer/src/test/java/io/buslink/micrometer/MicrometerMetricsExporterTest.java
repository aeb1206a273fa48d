package io.buslink.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void commandCounters() {
    exporter.incrementCommandsSent();
    exporter.incrementCommandsSent();
    exporter.incrementCommandsCompleted();
    exporter.incrementCommandsFailed();
    exporter.incrementCommandsCancelled();

    assertEquals(2.0, counter("buslink.commands.sent").count());
    assertEquals(1.0, counter("buslink.commands.completed").count());
    assertEquals(1.0, counter("buslink.commands.failed").count());
    assertEquals(1.0, counter("buslink.commands.cancelled").count());
  }

  @Test
  void eventCounters() {
    exporter.incrementEventsFired();
    exporter.incrementEventsReceived();
    exporter.incrementEventsAcknowledged();
    exporter.incrementEventsDropped();
    exporter.incrementListenerFailures();

    assertEquals(1.0, counter("buslink.events.fired").count());
    assertEquals(1.0, counter("buslink.events.received").count());
    assertEquals(1.0, counter("buslink.events.acknowledged").count());
    assertEquals(1.0, counter("buslink.events.dropped").count());
    assertEquals(1.0, counter("buslink.listener.failures").count());
  }

  @Test
  void queueDepthIsTaggedPerChannel() {
    exporter.recordQueueDepth("outbound", 4);
    exporter.recordQueueDepth("inbound", 1);
    exporter.recordQueueDepth("outbound", 2);

    assertEquals(2.0, gauge("buslink.queue.depth", "outbound").value());
    assertEquals(1.0, gauge("buslink.queue.depth", "inbound").value());
  }

  @Test
  void runningCommandsGauge() {
    exporter.recordRunningCommands("outbound", 3);
    assertEquals(3.0, gauge("buslink.commands.running", "outbound").value());
  }

  @Test
  void customPrefix() {
    SimpleMeterRegistry custom = new SimpleMeterRegistry();
    MicrometerMetricsExporter prefixed = new MicrometerMetricsExporter(custom, "orders.bus");
    prefixed.incrementEventsFired();

    assertEquals(1.0, custom.find("orders.bus.events.fired").counter().count());
    assertNull(custom.find("buslink.events.fired").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "bus."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesAllMeters() {
    exporter.recordQueueDepth("outbound", 1);
    exporter.close();

    assertNull(registry.find("buslink.commands.sent").counter());
    assertNull(registry.find("buslink.queue.depth").gauge());
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void noOpAfterClose() {
    exporter.close();
    assertDoesNotThrow(() -> {
      exporter.incrementEventsFired();
      exporter.recordQueueDepth("outbound", 5);
    });
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name, String channel) {
    Gauge g = registry.find(name).tag("channel", channel).gauge();
    assertNotNull(g, "Gauge not found: " + name + "{channel=" + channel + "}");
    return g;
  }
}
