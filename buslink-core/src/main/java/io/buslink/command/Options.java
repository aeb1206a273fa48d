package io.buslink.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class Options {

    private Options() {
    }

    static Map<String, Object> copyOf(Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
