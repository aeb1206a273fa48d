package io.buslink.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declaration of an event on an {@link Api}: its name and the parameters every firing
 * must supply, no more and no fewer.
 */
public final class Event {
    private final String name;
    private final List<Parameter> parameters;
    private final Set<String> parameterNames;

    private Event(String name, List<Parameter> parameters) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        Set<String> names = new LinkedHashSet<>();
        for (Parameter parameter : parameters) {
            if (!names.add(parameter.name())) {
                throw new IllegalArgumentException(
                        "Duplicate parameter '" + parameter.name() + "' on event " + name);
            }
        }
        this.parameterNames = Collections.unmodifiableSet(names);
    }

    /**
     * Declares an event whose parameters are untyped.
     *
     * @param name           the event name
     * @param parameterNames the parameter names
     * @return the event declaration
     */
    public static Event of(String name, String... parameterNames) {
        List<Parameter> parameters = new ArrayList<>();
        for (String parameterName : parameterNames) {
            parameters.add(Parameter.of(parameterName));
        }
        return new Event(name, parameters);
    }

    public static Event of(String name, List<Parameter> parameters) {
        return new Event(name, Objects.requireNonNull(parameters, "parameters"));
    }

    public String name() {
        return name;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Set<String> parameterNames() {
        return parameterNames;
    }

    @Override
    public String toString() {
        return "Event{" + name + parameterNames + '}';
    }
}
