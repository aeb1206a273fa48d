package io.buslink.command;

import io.buslink.UnsupportedCommandException;
import io.buslink.message.EventMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandRouterTest {

    private static final EventMessage MESSAGE = EventMessage.builder("shop", "order_placed").build();

    @Test
    void routesByConcreteType() throws Exception {
        List<String> calls = new CopyOnWriteArrayList<>();
        CommandRouter router = CommandRouter.builder()
                .route(SendEventCommand.class, command -> calls.add("send " + command.message().canonicalName()))
                .route(AcknowledgeEventCommand.class, command -> calls.add("ack"))
                .build();

        router.handle(new SendEventCommand(MESSAGE, Map.of()));
        router.handle(new AcknowledgeEventCommand(MESSAGE, null));

        assertEquals(List.of("send shop.order_placed", "ack"), calls);
    }

    @Test
    void unknownCommandFails() {
        CommandRouter router = CommandRouter.builder()
                .route(SendEventCommand.class, command -> { })
                .build();

        UnsupportedCommandException e = assertThrows(UnsupportedCommandException.class,
                () -> router.handle(new CloseTransportCommand()));
        assertTrue(e.getMessage().contains("CloseTransportCommand"));
    }

    @Test
    void handlerExceptionPropagates() {
        IllegalStateException boom = new IllegalStateException("boom");
        CommandRouter router = CommandRouter.builder()
                .route(CloseTransportCommand.class, command -> {
                    throw boom;
                })
                .build();

        assertSame(boom, assertThrows(IllegalStateException.class,
                () -> router.handle(new CloseTransportCommand())));
    }

    @Test
    void duplicateRouteRejected() {
        CommandRouter.Builder builder = CommandRouter.builder()
                .route(CloseTransportCommand.class, command -> { });

        assertThrows(IllegalArgumentException.class,
                () -> builder.route(CloseTransportCommand.class, command -> { }));
    }

    @Test
    void reportsSupportedTypes() {
        CommandRouter router = CommandRouter.builder()
                .route(ReceiveEventCommand.class, command -> { })
                .build();

        assertTrue(router.supports(ReceiveEventCommand.class));
        assertFalse(router.supports(SendEventCommand.class));
        assertEquals(Set.of(ReceiveEventCommand.class), router.supportedTypes());
    }

    @Test
    void commandsCopyOptions() {
        Map<String, Object> options = new java.util.HashMap<>();
        options.put("priority", 1);
        SendEventCommand command = new SendEventCommand(MESSAGE, options);
        options.put("priority", 2);

        assertEquals(1, command.options().get("priority"));
        assertTrue(new AcknowledgeEventCommand(MESSAGE, null).options().isEmpty());
    }
}
