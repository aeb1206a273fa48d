package io.buslink.command;

/**
 * Executes one command. Invoked by a {@link io.buslink.internal.CommandConsumer} on a
 * background thread; any exception is reported on the shared error channel.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Handles the command.
     *
     * @param command the command to execute
     * @throws Exception if execution fails
     */
    void handle(Command command) throws Exception;
}
