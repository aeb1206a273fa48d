package io.buslink.message;

import java.util.Objects;

/**
 * An {@code (apiName, eventName)} pair identifying one kind of event a listener is
 * interested in.
 */
public record EventKey(String apiName, String eventName) {

    public EventKey {
        Objects.requireNonNull(apiName, "apiName");
        Objects.requireNonNull(eventName, "eventName");
    }

    public static EventKey of(String apiName, String eventName) {
        return new EventKey(apiName, eventName);
    }

    /**
     * Parses the {@code api.name.event_name} form; everything before the last dot is the API.
     *
     * @param canonicalName the dotted event name
     * @return the parsed key
     * @throws IllegalArgumentException if there is no dot separating API and event
     */
    public static EventKey parse(String canonicalName) {
        Objects.requireNonNull(canonicalName, "canonicalName");
        int dot = canonicalName.lastIndexOf('.');
        if (dot <= 0 || dot == canonicalName.length() - 1) {
            throw new IllegalArgumentException(
                    "Expected <api>.<event> but got '" + canonicalName + "'");
        }
        return new EventKey(canonicalName.substring(0, dot), canonicalName.substring(dot + 1));
    }

    public String canonicalName() {
        return apiName + "." + eventName;
    }

    @Override
    public String toString() {
        return canonicalName();
    }
}
