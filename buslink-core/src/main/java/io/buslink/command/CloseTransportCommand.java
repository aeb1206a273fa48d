package io.buslink.command;

/**
 * Stop all consumers and close the transport. Sent once, when the client shuts down.
 */
public record CloseTransportCommand() implements Command {
}
