package io.buslink.command;

import io.buslink.message.EventMessage;

import java.util.Objects;

/**
 * An event delivered by the transport, addressed to a named listener.
 *
 * @param message      the received event
 * @param listenerName the listener the transport consumed it for
 */
public record ReceiveEventCommand(EventMessage message, String listenerName) implements Command {

    public ReceiveEventCommand {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(listenerName, "listenerName");
    }
}
