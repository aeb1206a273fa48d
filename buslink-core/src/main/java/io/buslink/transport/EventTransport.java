package io.buslink.transport;

import io.buslink.NothingToListenForException;
import io.buslink.UnsupportedTransportOperationException;
import io.buslink.message.EventKey;
import io.buslink.message.EventMessage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Publishes events and consumes them on behalf of named listeners.
 *
 * <h2>Consumption</h2>
 * <p>{@link #consume} returns a lazy, infinite stream of message batches; pulling the next
 * batch blocks until messages arrive. The stream ends with a
 * {@link io.buslink.TransportClosedException} once the transport is closed or the
 * consuming thread is interrupted. Consuming again opens a new stream.
 *
 * <h2>Acknowledgement</h2>
 * <p>{@link #acknowledge} is called after a listener processed a message successfully.
 * It defaults to a no-op for transports without at-least-once delivery.
 */
public interface EventTransport extends Transport {

    /**
     * Publishes an event.
     *
     * @param message the event
     * @param options transport-specific options
     * @throws Exception if publishing fails
     */
    default void sendEvent(EventMessage message, Map<String, Object> options) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "sending events");
    }

    /**
     * Opens a stream of message batches for the given events.
     *
     * <p>Implementations should call {@link #checkListenFor} first.
     *
     * @param listenFor    the {@code (api, event)} pairs to consume; must not be empty
     * @param listenerName the unique name of the consuming listener
     * @param options      transport-specific options
     * @return a lazy, infinite stream of batches
     * @throws NothingToListenForException if {@code listenFor} is empty
     * @throws Exception                   if the stream cannot be opened
     */
    default Stream<List<EventMessage>> consume(List<EventKey> listenFor, String listenerName,
                                               Map<String, Object> options) throws Exception {
        checkListenFor(listenFor);
        throw UnsupportedTransportOperationException.of(this, "listening for events");
    }

    /**
     * Acknowledges that the given messages were processed successfully.
     *
     * @param messages the processed messages
     * @throws Exception if the acknowledgement fails
     */
    default void acknowledge(EventMessage... messages) throws Exception {
    }

    /**
     * Returns past messages for one event, newest first.
     *
     * @param apiName        the API name
     * @param eventName      the event name
     * @param start          lower time bound, or {@code null} for none
     * @param stop           upper time bound, or {@code null} for none
     * @param startInclusive whether a message exactly at {@code start} is included
     * @return a lazy stream of messages, newest first
     * @throws Exception if history cannot be read
     */
    default Stream<EventMessage> history(String apiName, String eventName, Instant start, Instant stop,
                                         boolean startInclusive) throws Exception {
        throw UnsupportedTransportOperationException.of(this, "event history");
    }

    /**
     * Fails if there is nothing to listen for.
     *
     * @param listenFor the requested {@code (api, event)} pairs
     * @throws NothingToListenForException if {@code listenFor} is null or empty
     */
    static void checkListenFor(List<EventKey> listenFor) {
        if (listenFor == null || listenFor.isEmpty()) {
            throw new NothingToListenForException("EventTransport.consume() was called without providing "
                    + "anything to listen for in the listenFor argument.");
        }
    }
}
