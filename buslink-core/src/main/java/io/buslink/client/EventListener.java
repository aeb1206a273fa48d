package io.buslink.client;

import io.buslink.message.EventMessage;

import java.util.Map;

/**
 * Callback invoked for every event a listener receives.
 *
 * <p>Runs on the listener's own consumption thread, one message at a time. Throwing marks
 * the message as failed: it is reported on the error channel and not acknowledged.
 */
@FunctionalInterface
public interface EventListener {

    /**
     * Processes one event.
     *
     * @param message the received event
     * @param kwargs  the event's keyword arguments, cast to the listener's signature when one
     *                was declared and casting is enabled for the API
     * @throws Exception if processing fails
     */
    void onEvent(EventMessage message, Map<String, Object> kwargs) throws Exception;
}
