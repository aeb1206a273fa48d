package io.buslink.internal;

import io.buslink.command.CloseTransportCommand;
import io.buslink.testing.RecordingMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandProducerTest {

    private final Logger producerLogger = Logger.getLogger(CommandProducer.class.getName());
    private final List<LogRecord> warnings = new CopyOnWriteArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            if (record.getLevel() == Level.WARNING) {
                warnings.add(record);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    private CommandQueue queue;
    private ErrorChannel errors;

    @BeforeEach
    void setUp() {
        queue = new CommandQueue();
        errors = new ErrorChannel();
        producerLogger.addHandler(capture);
    }

    @AfterEach
    void tearDown() {
        producerLogger.removeHandler(capture);
    }

    private CommandProducer.Builder builder() {
        return CommandProducer.builder().name("test").queue(queue).errorChannel(errors);
    }

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNullQueue() {
        assertThrows(NullPointerException.class, () ->
                CommandProducer.builder().errorChannel(errors).build());
    }

    @Test
    void builderRejectsNullErrorChannel() {
        assertThrows(NullPointerException.class, () ->
                CommandProducer.builder().queue(queue).build());
    }

    @Test
    void builderRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> builder().monitorIntervalMs(0).build());
    }

    @Test
    void builderRejectsSizeWarningBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> builder().sizeWarning(0).build());
    }

    // ── Sending ─────────────────────────────────────────────────────

    @Test
    void sendEnqueuesWithUnsetSignal() throws Exception {
        CommandProducer producer = builder().build();
        CloseTransportCommand command = new CloseTransportCommand();

        CompletionSignal signal = producer.send(command);

        assertFalse(signal.isSet());
        assertEquals(1, queue.size());
        QueuedCommand queued = queue.take();
        assertSame(command, queued.command());
        assertSame(signal, queued.signal());
    }

    @Test
    void sendRejectsNull() {
        CommandProducer producer = builder().build();
        assertThrows(NullPointerException.class, () -> producer.send(null));
    }

    // ── Monitor ─────────────────────────────────────────────────────

    @Test
    void waitUntilReadyReturnsOnceMonitorRan() throws Exception {
        try (CommandProducer producer = builder().monitorIntervalMs(10).build()) {
            assertFalse(producer.waitUntilReady(20, TimeUnit.MILLISECONDS));

            producer.start();

            assertTrue(producer.waitUntilReady(2, TimeUnit.SECONDS));
            assertTrue(producer.isRunning());
        }
    }

    @Test
    void stopIsIdempotentAndResetsReadiness() throws Exception {
        CommandProducer producer = builder().monitorIntervalMs(10).build();
        producer.start();
        producer.waitUntilReady();

        producer.stop();
        producer.stop();

        assertFalse(producer.isRunning());
        assertFalse(producer.waitUntilReady(20, TimeUnit.MILLISECONDS));
    }

    @Test
    void warnsOnGrowthAndRecovery() throws Exception {
        CommandProducer producer = builder().sizeWarning(2).build();

        producer.monitorQueue();
        producer.send(new CloseTransportCommand());
        producer.send(new CloseTransportCommand());
        producer.monitorQueue();
        producer.monitorQueue();
        queue.take();
        queue.take();
        producer.monitorQueue();

        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).getMessage().contains("now has 2 commands"));
        assertTrue(warnings.get(1).getMessage().contains("OK size again"));
    }

    @Test
    void monitorFailuresGoToErrorChannel() {
        RuntimeException boom = new RuntimeException("boom");
        RecordingMetrics metrics = new RecordingMetrics();
        metrics.failOnQueueDepth(boom);
        CommandProducer producer = builder().metrics(metrics).build();

        producer.monitorQueue();

        assertSame(boom, errors.poll());
    }

    @Test
    void recordsQueueDepthAndSentCount() throws Exception {
        RecordingMetrics metrics = new RecordingMetrics();
        CommandProducer producer = builder().metrics(metrics).build();
        producer.send(new CloseTransportCommand());

        producer.monitorQueue();

        assertEquals(1, metrics.queueDepths.get("test"));
        assertEquals(1, metrics.commandsSent.get());
        assertInstanceOf(CloseTransportCommand.class, queue.take().command());
    }
}
