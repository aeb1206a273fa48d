package io.buslink;

/**
 * Thrown when an API name is not present in the local {@link io.buslink.api.ApiRegistry}.
 */
public class UnknownApiException extends BusException {

    public UnknownApiException(String message) {
        super(message);
    }
}
