package io.buslink.internal;

import io.buslink.command.Command;

import java.util.Objects;

/**
 * A command paired with the signal that is set once its handler has finished.
 */
public record QueuedCommand(Command command, CompletionSignal signal) {

    public QueuedCommand {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(signal, "signal");
    }
}
