package io.buslink.api;

import java.util.Objects;

/**
 * A named, typed parameter of an event.
 *
 * @param name the keyword argument name
 * @param type the declared Java type; {@code Object.class} when untyped
 */
public record Parameter(String name, Class<?> type) {

    public Parameter {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
        Objects.requireNonNull(type, "type");
    }

    public static Parameter of(String name) {
        return new Parameter(name, Object.class);
    }

    public static Parameter of(String name, Class<?> type) {
        return new Parameter(name, type);
    }
}
