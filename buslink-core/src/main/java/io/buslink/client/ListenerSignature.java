package io.buslink.client;

import io.buslink.InvalidEventListenerException;
import io.buslink.api.Parameter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The keyword arguments a listener declares, with the types incoming values are cast to.
 *
 * <pre>{@code
 * ListenerSignature signature = ListenerSignature.of(
 *     Parameter.of("order_id", Long.class),
 *     Parameter.of("placed_at", Instant.class));
 * }</pre>
 */
public final class ListenerSignature {
    private final Map<String, Class<?>> types;

    private ListenerSignature(Map<String, Class<?>> types) {
        this.types = Collections.unmodifiableMap(types);
    }

    /**
     * Creates a signature from the given parameters.
     *
     * @param parameters the declared parameters
     * @return the signature
     * @throws InvalidEventListenerException if a parameter name appears twice
     */
    public static ListenerSignature of(Parameter... parameters) {
        Map<String, Class<?>> types = new LinkedHashMap<>();
        for (Parameter parameter : parameters) {
            Objects.requireNonNull(parameter, "parameter");
            if (types.put(parameter.name(), parameter.type()) != null) {
                throw new InvalidEventListenerException("Listener declares parameter '"
                        + parameter.name() + "' more than once");
            }
        }
        return new ListenerSignature(types);
    }

    public Map<String, Class<?>> types() {
        return types;
    }

    @Override
    public String toString() {
        return "ListenerSignature" + types;
    }
}
