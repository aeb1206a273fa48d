package io.buslink;

/**
 * Thrown when an event transport is asked to consume without any {@code (api, event)} pairs.
 */
public class NothingToListenForException extends BusException {

    public NothingToListenForException(String message) {
        super(message);
    }
}
