package io.buslink.client;

import io.buslink.BusConfig;
import io.buslink.DuplicateListenerException;
import io.buslink.EventNotFoundException;
import io.buslink.InvalidEventArgumentsException;
import io.buslink.InvalidEventListenerException;
import io.buslink.InvalidNameException;
import io.buslink.NothingToListenForException;
import io.buslink.SchemaValidationException;
import io.buslink.UnknownApiException;
import io.buslink.api.Api;
import io.buslink.api.ApiRegistry;
import io.buslink.api.Event;
import io.buslink.api.Parameter;
import io.buslink.command.AcknowledgeEventCommand;
import io.buslink.command.ConsumeEventsCommand;
import io.buslink.command.ReceiveEventCommand;
import io.buslink.command.SendEventCommand;
import io.buslink.internal.CommandConsumer;
import io.buslink.internal.CommandProducer;
import io.buslink.internal.CommandQueue;
import io.buslink.internal.ErrorChannel;
import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;
import io.buslink.plugin.BusPlugin;
import io.buslink.plugin.PluginRegistry;
import io.buslink.schema.Schema;
import io.buslink.schema.SchemaValidator;
import io.buslink.testing.RecordingCommandHandler;
import io.buslink.testing.RecordingMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventClientTest {

    private static final EventKey ORDER_PLACED = EventKey.of("shop", "order_placed");
    private static final long TIMEOUT_MS = 2000;

    private ErrorChannel errors;
    private RecordingMetrics metrics;
    private RecordingCommandHandler transportSide;
    private CommandConsumer consumer;
    private CommandProducer producer;
    private PluginRegistry plugins;
    private BusConfig config;
    private EventClient client;

    @BeforeEach
    void setUp() {
        errors = new ErrorChannel();
        metrics = new RecordingMetrics();
        transportSide = new RecordingCommandHandler();
        CommandQueue queue = new CommandQueue();
        producer = CommandProducer.builder().name("outbound").queue(queue).errorChannel(errors).build();
        consumer = CommandConsumer.builder().name("outbound").queue(queue).errorChannel(errors).build();
        consumer.start(transportSide);
        plugins = new PluginRegistry();
        config = new BusConfig();
        client = newClient(SchemaValidator.NOOP);
    }

    @AfterEach
    void tearDown() {
        client.close();
        consumer.close();
    }

    private EventClient newClient(SchemaValidator validator) {
        Api shop = Api.builder("shop")
                .event(Event.of("order_placed", "order_id"))
                .build();
        return EventClient.builder()
                .apis(new ApiRegistry().add(shop))
                .producer(producer)
                .errorChannel(errors)
                .config(config)
                .plugins(plugins)
                .validator(validator)
                .metrics(metrics)
                .build();
    }

    private static EventMessage orderPlaced(Object orderId) {
        return EventMessage.builder("shop", "order_placed").kwargs(Map.of("order_id", orderId)).build();
    }

    // ── Fire ────────────────────────────────────────────────────────

    @Test
    void fireEventSendsOneCommandAndWaitsForIt() throws Exception {
        EventMessage fired = client.fireEvent("shop", "order_placed", Map.of("order_id", 1));

        SendEventCommand sent = transportSide.next(SendEventCommand.class, TIMEOUT_MS);
        assertNotNull(sent);
        assertSame(fired, sent.message());
        assertEquals(Map.of("order_id", 1), fired.kwargs());
        assertNull(transportSide.next(SendEventCommand.class, 50));
        assertEquals(1, metrics.eventsFired.get());
    }

    @Test
    void fireEventWithExtraArgumentReportsBothSets() {
        Map<String, Object> kwargs = new LinkedHashMap<>();
        kwargs.put("order_id", 1);
        kwargs.put("extra", 2);

        InvalidEventArgumentsException e = assertThrows(InvalidEventArgumentsException.class,
                () -> client.fireEvent("shop", "order_placed", kwargs));

        assertEquals(2, e.suppliedCount());
        assertEquals(1, e.expectedCount());
        assertEquals(Set.of("extra", "order_id"), e.suppliedNames());
        assertEquals(Set.of("order_id"), e.expectedNames());
        assertTrue(e.getMessage().contains("2 arguments: [extra, order_id]"));
        assertTrue(e.getMessage().contains("expected 1: [order_id]"));
    }

    @Test
    void fireEventWithMissingArgumentFails() {
        assertThrows(InvalidEventArgumentsException.class,
                () -> client.fireEvent("shop", "order_placed", Map.of()));
        assertThrows(InvalidEventArgumentsException.class,
                () -> client.fireEvent("shop", "order_placed", null));
    }

    @Test
    void fireEventForUnknownApiFails() {
        assertThrows(UnknownApiException.class,
                () -> client.fireEvent("billing", "invoice_paid", Map.of()));
    }

    @Test
    void unknownApiIsReportedBeforeNameSyntax() {
        assertThrows(UnknownApiException.class,
                () -> client.fireEvent("not an api", "order_placed", Map.of("order_id", 1)));
    }

    @Test
    void fireEventForUnknownEventFails() {
        assertThrows(EventNotFoundException.class,
                () -> client.fireEvent("shop", "order_lost", Map.of()));
    }

    @Test
    void fireEventDeformsValues() throws Exception {
        EventMessage fired = client.fireEvent("shop", "order_placed",
                Map.of("order_id", new java.math.BigDecimal("12.50")));

        assertEquals("12.50", fired.kwargs().get("order_id"));
    }

    @Test
    void outgoingValidationFailureStopsSend() throws Exception {
        client.close();
        client = newClient(new SchemaValidator() {
            @Override
            public void validateOutgoing(BusConfig config, Schema schema, EventMessage message) {
                throw new SchemaValidationException("order_id must be a string");
            }

            @Override
            public void validateIncoming(BusConfig config, Schema schema, EventMessage message) {
            }
        });

        assertThrows(SchemaValidationException.class,
                () -> client.fireEvent("shop", "order_placed", Map.of("order_id", 1)));
        assertNull(transportSide.next(SendEventCommand.class, 50));
    }

    @Test
    void outgoingValidationCanBeDisabledPerApi() throws Exception {
        config.api("shop", new BusConfig.ApiConfig().validateOutgoing(false));
        client.close();
        client = newClient(new SchemaValidator() {
            @Override
            public void validateOutgoing(BusConfig config, Schema schema, EventMessage message) {
                throw new SchemaValidationException("should not be called");
            }

            @Override
            public void validateIncoming(BusConfig config, Schema schema, EventMessage message) {
            }
        });

        client.fireEvent("shop", "order_placed", Map.of("order_id", 1));

        assertNotNull(transportSide.next(SendEventCommand.class, TIMEOUT_MS));
    }

    @Test
    void sendHooksWrapTheSend() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        plugins.register(new BusPlugin() {
            @Override
            public void beforeEventSent(EventMessage message) {
                calls.add("before");
            }

            @Override
            public void afterEventSent(EventMessage message) {
                calls.add("after");
            }
        });

        client.fireEvent("shop", "order_placed", Map.of("order_id", 1));

        assertEquals(List.of("before", "after"), calls);
    }

    // ── Listen ──────────────────────────────────────────────────────

    @Test
    void listenSendsConsumeCommand() throws Exception {
        ListenerRegistration registration = client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L1");

        ConsumeEventsCommand consume = transportSide.next(ConsumeEventsCommand.class, TIMEOUT_MS);
        assertNotNull(consume);
        assertEquals("L1", consume.listenerName());
        assertEquals(List.of(ORDER_PLACED), consume.events());
        assertSame(registration.intake(), consume.destinationQueue());
        assertTrue(client.listeners().get("L1").isPresent());
    }

    @Test
    void duplicateListenerNameFails() throws Exception {
        client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L1");

        assertThrows(DuplicateListenerException.class,
                () -> client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L1"));
        client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L2");
        assertEquals(2, client.listeners().all().size());
    }

    @Test
    void duplicateNameIsReportedBeforeNameSyntax() throws Exception {
        client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L1");

        assertThrows(DuplicateListenerException.class,
                () -> client.listen(List.of(EventKey.of("shop", "_internal")), (m, kw) -> { }, "L1"));
    }

    @Test
    void interruptedListenReleasesTheName() throws Exception {
        CommandProducer idle = CommandProducer.builder().name("idle").queue(new CommandQueue()).errorChannel(errors).build();
        EventClient stalled = EventClient.builder()
                .apis(new ApiRegistry())
                .producer(idle)
                .errorChannel(errors)
                .build();
        try {
            Thread.currentThread().interrupt();
            assertThrows(InterruptedException.class,
                    () -> stalled.listen(List.of(ORDER_PLACED), (m, kw) -> { }, "L1"));
            assertTrue(Thread.interrupted());
            assertTrue(stalled.listeners().get("L1").isEmpty());
        } finally {
            Thread.interrupted();
            stalled.close();
        }
    }

    @Test
    void invalidListenRequestsFail() {
        assertThrows(InvalidEventListenerException.class,
                () -> client.listen(List.of(ORDER_PLACED), null, "L1"));
        assertThrows(NothingToListenForException.class,
                () -> client.listen(List.of(), (m, kw) -> { }, "L1"));
        assertThrows(InvalidNameException.class,
                () -> client.listen(List.of(EventKey.of("shop", "_internal")), (m, kw) -> { }, "L1"));
        assertThrows(InvalidNameException.class,
                () -> client.listen(List.of(ORDER_PLACED), (m, kw) -> { }, ""));
    }

    @Test
    void duplicateSignatureParameterIsAnInvalidListener() {
        assertThrows(InvalidEventListenerException.class, () -> ListenerSignature.of(
                Parameter.of("order_id"), Parameter.of("order_id", Long.class)));
    }

    // ── Receive ─────────────────────────────────────────────────────

    @Test
    void receivedEventIsProcessedAndAcknowledged() throws Exception {
        BlockingQueue<EventMessage> seen = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> seen.add(m), "L1");
        EventMessage message = orderPlaced(1);

        client.handle(new ReceiveEventCommand(message, "L1"));

        assertSame(message, seen.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        AcknowledgeEventCommand ack = transportSide.next(AcknowledgeEventCommand.class, TIMEOUT_MS);
        assertNotNull(ack);
        assertSame(message, ack.message());
        assertEquals(1, metrics.eventsReceived.get());
    }

    @Test
    void receivedEventIsQueuedForItsListener() throws Exception {
        CountDownLatch block = new CountDownLatch(1);
        ListenerRegistration registration = client.listen(List.of(ORDER_PLACED), (m, kw) -> block.await(), "L1");
        EventMessage first = orderPlaced(1);
        EventMessage second = orderPlaced(2);

        client.handleReceiveEvent(new ReceiveEventCommand(first, "L1"));
        client.handleReceiveEvent(new ReceiveEventCommand(second, "L1"));

        assertTrue(registration.intake().contains(second));
        block.countDown();
    }

    @Test
    void eventForUnknownListenerIsDropped() throws Exception {
        client.handle(new ReceiveEventCommand(orderPlaced(1), "nobody"));

        assertEquals(1, metrics.eventsDropped.get());
        assertTrue(errors.isEmpty());
    }

    @Test
    void listenerFailureIsReportedAndNotAcknowledged() throws Exception {
        IllegalStateException boom = new IllegalStateException("listener failed");
        BlockingQueue<EventMessage> seen = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> {
            if (kw.get("order_id").equals(1)) {
                throw boom;
            }
            seen.add(m);
        }, "L1");
        EventMessage failing = orderPlaced(1);
        EventMessage working = orderPlaced(2);

        client.handle(new ReceiveEventCommand(failing, "L1"));
        client.handle(new ReceiveEventCommand(working, "L1"));

        assertSame(boom, errors.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertSame(working, seen.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        AcknowledgeEventCommand ack = transportSide.next(AcknowledgeEventCommand.class, TIMEOUT_MS);
        assertSame(working, ack.message());
        assertEquals(1, metrics.listenerFailures.get());
    }

    @Test
    void listenerErrorDoesNotStopLaterMessages() throws Exception {
        BlockingQueue<EventMessage> seen = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> {
            if (kw.get("order_id").equals(1)) {
                throw new AssertionError("listener broke");
            }
            seen.add(m);
        }, "L1");
        EventMessage working = orderPlaced(2);

        client.handle(new ReceiveEventCommand(orderPlaced(1), "L1"));
        client.handle(new ReceiveEventCommand(working, "L1"));

        assertInstanceOf(AssertionError.class, errors.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertSame(working, seen.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(1, metrics.listenerFailures.get());
        assertTrue(errors.isEmpty());
    }

    @Test
    void kwargsAreCastToListenerSignature() throws Exception {
        BlockingQueue<Object> values = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> values.add(kw.get("order_id")), "L1",
                ListenerSignature.of(Parameter.of("order_id", long.class)), Map.of());

        client.handle(new ReceiveEventCommand(orderPlaced("42"), "L1"));

        assertEquals(42L, values.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void castingCanBeDisabledPerApi() throws Exception {
        config.api("shop", new BusConfig.ApiConfig().castValues(false));
        BlockingQueue<Object> values = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> values.add(kw.get("order_id")), "L1",
                ListenerSignature.of(Parameter.of("order_id", long.class)), Map.of());

        client.handle(new ReceiveEventCommand(orderPlaced("42"), "L1"));

        assertEquals("42", values.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void incomingValidationFailureSkipsListener() throws Exception {
        client.close();
        client = newClient(new SchemaValidator() {
            @Override
            public void validateOutgoing(BusConfig config, Schema schema, EventMessage message) {
            }

            @Override
            public void validateIncoming(BusConfig config, Schema schema, EventMessage message) {
                throw new SchemaValidationException("bad incoming");
            }
        });
        BlockingQueue<EventMessage> seen = new LinkedBlockingQueue<>();
        client.listen(List.of(ORDER_PLACED), (m, kw) -> seen.add(m), "L1");

        client.handle(new ReceiveEventCommand(orderPlaced(1), "L1"));

        assertInstanceOf(SchemaValidationException.class, errors.poll(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertNull(seen.poll(50, TimeUnit.MILLISECONDS));
        assertNull(transportSide.next(AcknowledgeEventCommand.class, 50));
    }

    @Test
    void executionHooksRunAroundListener() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        plugins.register(new BusPlugin() {
            @Override
            public void beforeEventExecution(EventMessage message) {
                calls.add("before");
            }

            @Override
            public void afterEventExecution(EventMessage message) {
                calls.add("after");
                done.countDown();
            }
        });
        client.listen(List.of(ORDER_PLACED), (m, kw) -> calls.add("listener"), "L1");

        client.handle(new ReceiveEventCommand(orderPlaced(1), "L1"));

        assertTrue(done.await(TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertEquals(List.of("before", "listener", "after"), calls);
    }
}
