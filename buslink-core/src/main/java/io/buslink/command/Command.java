package io.buslink.command;

/**
 * One unit of work crossing the boundary between the client API and the transport layer.
 *
 * <p>Commands are immutable once constructed and are consumed exactly once by a handler.
 * The set of variants is closed; handlers route on the concrete type through a
 * {@link CommandRouter}.
 */
public sealed interface Command
        permits SendEventCommand, AcknowledgeEventCommand, ConsumeEventsCommand,
        ReceiveEventCommand, CloseTransportCommand {
}
