package io.buslink.api;

import io.buslink.UnknownApiException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of the APIs this process is authoritative for.
 */
public final class ApiRegistry {
    private final Map<String, Api> apis = new ConcurrentHashMap<>();

    /**
     * Registers an API.
     *
     * @param api the API
     * @return this registry for chaining
     * @throws IllegalArgumentException if an API with the same name is already registered
     */
    public ApiRegistry add(Api api) {
        Objects.requireNonNull(api, "api");
        if (apis.putIfAbsent(api.name(), api) != null) {
            throw new IllegalArgumentException("An API named " + api.name() + " is already registered");
        }
        return this;
    }

    /**
     * Looks up an API by name.
     *
     * @param name the API name
     * @return the API
     * @throws UnknownApiException if no API with that name is registered
     */
    public Api get(String name) {
        Api api = name == null ? null : apis.get(name);
        if (api == null) {
            throw new UnknownApiException("No API named " + name + " was found in the registry");
        }
        return api;
    }

    public boolean contains(String name) {
        return name != null && apis.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(apis.keySet()));
    }

    public List<Api> all() {
        return Collections.unmodifiableList(new ArrayList<>(apis.values()));
    }
}
