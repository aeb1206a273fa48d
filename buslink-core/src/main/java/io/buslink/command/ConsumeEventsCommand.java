package io.buslink.command;

import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;

/**
 * Start consuming the given events from the transport on behalf of a listener.
 *
 * <p>The {@code destinationQueue} is the listener's intake queue. It is shared, mutable
 * state by nature; the command itself is otherwise immutable.
 *
 * @param events           the {@code (api, event)} pairs to consume
 * @param destinationQueue the listener's intake queue
 * @param listenerName     the unique listener name
 * @param options          transport-specific options, never {@code null}
 */
public record ConsumeEventsCommand(List<EventKey> events,
                                   BlockingQueue<EventMessage> destinationQueue,
                                   String listenerName,
                                   Map<String, Object> options) implements Command {

    public ConsumeEventsCommand {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
        Objects.requireNonNull(destinationQueue, "destinationQueue");
        Objects.requireNonNull(listenerName, "listenerName");
        options = Options.copyOf(options);
    }
}
