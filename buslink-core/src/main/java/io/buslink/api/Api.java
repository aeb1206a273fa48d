package io.buslink.api;

import io.buslink.EventNotFoundException;
import io.buslink.util.Names;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A locally defined API: a name, a version and the events it may fire.
 *
 * <p>Having an API in the local {@link ApiRegistry} makes this process an authority on it;
 * only authoritative APIs may fire events.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Api shop = Api.builder("shop")
 *     .version(2)
 *     .event(Event.of("order_placed", "order_id"))
 *     .build();
 * }</pre>
 */
public final class Api {
    private final String name;
    private final int version;
    private final Map<String, Event> events;

    private Api(Builder builder) {
        this.name = builder.name;
        Names.validateApiName(name);
        if (builder.version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        this.version = builder.version;
        this.events = Collections.unmodifiableMap(new LinkedHashMap<>(builder.events));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public int version() {
        return version;
    }

    public Map<String, Event> events() {
        return events;
    }

    /**
     * Returns the declared event with the given name.
     *
     * @param eventName the event name
     * @return the event declaration
     * @throws EventNotFoundException if this API declares no such event
     */
    public Event event(String eventName) {
        Event event = events.get(eventName);
        if (event == null) {
            throw new EventNotFoundException("The API " + name + " does not seem to contain an event named "
                    + eventName + ". You may need to define the event, you may also be using the incorrect API. "
                    + "Also check for typos.");
        }
        return event;
    }

    public boolean hasEvent(String eventName) {
        return events.containsKey(eventName);
    }

    @Override
    public String toString() {
        return "Api{" + name + " v" + version + ", events=" + events.keySet() + '}';
    }

    /** Builder for {@link Api}. */
    public static final class Builder {
        private final String name;
        private int version = 1;
        private final Map<String, Event> events = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /**
         * Sets the API version stamped on every fired event.
         *
         * <p>Optional. Defaults to {@code 1}.
         *
         * @param version the version
         * @return this builder
         */
        public Builder version(int version) {
            this.version = version;
            return this;
        }

        /**
         * Declares an event.
         *
         * @param event the event declaration
         * @return this builder
         * @throws IllegalArgumentException if an event with the same name was already declared
         */
        public Builder event(Event event) {
            Objects.requireNonNull(event, "event");
            Names.validateEventOrRpcName(name, "event", event.name());
            if (events.putIfAbsent(event.name(), event) != null) {
                throw new IllegalArgumentException("Duplicate event '" + event.name() + "' on API " + name);
            }
            return this;
        }

        public Api build() {
            return new Api(this);
        }
    }
}
