package io.buslink.message;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, transport-independent representation of one event occurrence.
 *
 * <p>Each message is assigned a ULID-based {@code id} unless one is supplied. Keyword
 * arguments keep their insertion order and must have non-null string keys; values may be
 * {@code null}. A transport may attach its own {@code nativeId} (a stream offset, a
 * delivery tag) so that it can later acknowledge the message.
 *
 * @see EventKey
 */
public final class EventMessage {
    private final String id;
    private final String apiName;
    private final String eventName;
    private final int version;
    private final Map<String, Object> kwargs;
    private final String nativeId;

    private EventMessage(Builder builder) {
        this.id = builder.id == null ? newMessageId() : builder.id;
        this.apiName = Objects.requireNonNull(builder.apiName, "apiName");
        this.eventName = Objects.requireNonNull(builder.eventName, "eventName");
        if (builder.version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        this.version = builder.version;
        Map<String, Object> copy = builder.kwargs == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.kwargs));
        if (copy.containsKey(null)) {
            throw new IllegalArgumentException("kwargs cannot contain null keys");
        }
        this.kwargs = copy;
        this.nativeId = builder.nativeId;
    }

    public static Builder builder(String apiName, String eventName) {
        return new Builder(apiName, eventName);
    }

    public String id() {
        return id;
    }

    public String apiName() {
        return apiName;
    }

    public String eventName() {
        return eventName;
    }

    public int version() {
        return version;
    }

    public Map<String, Object> kwargs() {
        return kwargs;
    }

    /**
     * Returns the transport-assigned identifier, or {@code null} if the message has not
     * passed through a transport that assigns one.
     *
     * @return the native identifier, or {@code null}
     */
    public String nativeId() {
        return nativeId;
    }

    public EventKey key() {
        return new EventKey(apiName, eventName);
    }

    public String canonicalName() {
        return apiName + "." + eventName;
    }

    /**
     * Returns a copy of this message carrying the given transport identifier.
     *
     * @param nativeId the transport-assigned identifier
     * @return a new message with the same id, names, version and kwargs
     */
    public EventMessage withNativeId(String nativeId) {
        return builder(apiName, eventName)
                .id(id)
                .version(version)
                .kwargs(kwargs)
                .nativeId(nativeId)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMessage)) return false;
        EventMessage that = (EventMessage) o;
        return version == that.version
                && id.equals(that.id)
                && apiName.equals(that.apiName)
                && eventName.equals(that.eventName)
                && kwargs.equals(that.kwargs)
                && Objects.equals(nativeId, that.nativeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, apiName, eventName, version, kwargs, nativeId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EventMessage{id=").append(id)
                .append(", event=").append(canonicalName())
                .append(", version=").append(version);
        if (nativeId != null) {
            sb.append(", nativeId=").append(nativeId);
        }
        return sb.append('}').toString();
    }

    private static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /**
     * Builder for {@link EventMessage}.
     */
    public static final class Builder {
        private final String apiName;
        private final String eventName;
        private String id;
        private int version = 1;
        private Map<String, Object> kwargs;
        private String nativeId;

        private Builder(String apiName, String eventName) {
            this.apiName = apiName;
            this.eventName = eventName;
        }

        /**
         * Sets a custom message identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param id the message identifier
         * @return this builder
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Sets the version of the API that produced the event.
         *
         * <p>Optional. Defaults to {@code 1}. Must be &ge; 1.
         *
         * @param version the API version
         * @return this builder
         */
        public Builder version(int version) {
            this.version = version;
            return this;
        }

        /**
         * Sets the keyword arguments. The map is copied at build time.
         *
         * @param kwargs the keyword arguments
         * @return this builder
         */
        public Builder kwargs(Map<String, ?> kwargs) {
            this.kwargs = kwargs == null ? null : new LinkedHashMap<>(kwargs);
            return this;
        }

        public Builder nativeId(String nativeId) {
            this.nativeId = nativeId;
            return this;
        }

        public EventMessage build() {
            return new EventMessage(this);
        }
    }
}
