package io.buslink.plugin;

import io.buslink.BusConfig;
import io.buslink.message.EventMessage;

/**
 * Extension invoked around event sending and listener execution.
 *
 * <p>All methods default to no-ops. Hooks run on the calling thread and must not block
 * indefinitely. An exception thrown from a {@code before} hook aborts the operation; one
 * thrown from an {@code after} hook is logged and does not affect the outcome.
 */
public interface BusPlugin {

    /**
     * Called once when the owning client opens.
     *
     * @param config the client configuration
     * @throws Exception if the plugin cannot start
     */
    default void init(BusConfig config) throws Exception {
    }

    /**
     * Called once when the owning client closes.
     *
     * @throws Exception if cleanup fails
     */
    default void teardown() throws Exception {
    }

    default void beforeEventSent(EventMessage message) throws Exception {
    }

    default void afterEventSent(EventMessage message) throws Exception {
    }

    default void beforeEventExecution(EventMessage message) throws Exception {
    }

    default void afterEventExecution(EventMessage message) throws Exception {
    }
}
