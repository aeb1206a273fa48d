package io.buslink.command;

import io.buslink.message.EventMessage;

import java.util.Map;
import java.util.Objects;

/**
 * Publish an event through the event transport.
 *
 * @param message the event to publish
 * @param options transport-specific options, never {@code null}
 */
public record SendEventCommand(EventMessage message, Map<String, Object> options) implements Command {

    public SendEventCommand {
        Objects.requireNonNull(message, "message");
        options = Options.copyOf(options);
    }
}
