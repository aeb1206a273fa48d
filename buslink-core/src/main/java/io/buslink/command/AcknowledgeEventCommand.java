package io.buslink.command;

import io.buslink.message.EventMessage;

import java.util.Map;
import java.util.Objects;

/**
 * Tell the event transport a received message was processed successfully.
 *
 * @param message the processed message
 * @param options transport-specific options, never {@code null}
 */
public record AcknowledgeEventCommand(EventMessage message, Map<String, Object> options) implements Command {

    public AcknowledgeEventCommand {
        Objects.requireNonNull(message, "message");
        options = Options.copyOf(options);
    }
}
