package io.buslink.client;

import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

/**
 * One registered listener: its unique name, the events it listens for, its callback and
 * the intake queue received events are placed on.
 */
public final class ListenerRegistration {
    private final String name;
    private final List<EventKey> events;
    private final EventListener listener;
    private final ListenerSignature signature;
    private final Map<String, Object> options;
    private final BlockingQueue<EventMessage> intake;

    ListenerRegistration(String name, List<EventKey> events, EventListener listener,
                         ListenerSignature signature, Map<String, Object> options,
                         BlockingQueue<EventMessage> intake) {
        this.name = Objects.requireNonNull(name, "name");
        this.events = List.copyOf(events);
        this.listener = Objects.requireNonNull(listener, "listener");
        this.signature = signature;
        this.options = options == null ? Map.of() : Map.copyOf(options);
        this.intake = Objects.requireNonNull(intake, "intake");
    }

    public String name() {
        return name;
    }

    public List<EventKey> events() {
        return events;
    }

    public EventListener listener() {
        return listener;
    }

    public Optional<ListenerSignature> signature() {
        return Optional.ofNullable(signature);
    }

    public Map<String, Object> options() {
        return options;
    }

    /**
     * Returns the queue of received events not yet processed by the listener.
     */
    public BlockingQueue<EventMessage> intake() {
        return intake;
    }

    @Override
    public String toString() {
        return "ListenerRegistration{name=" + name + ", events=" + events + '}';
    }
}
