package com.recursa.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action emitted by the model: a tool call, a sub-agent spawn, or the terminal output.
 *
 * @param name      action name as it appears in the capability table
 * @param arguments named arguments, never null
 */
public record Action(
    String name,
    Map<String, Object> arguments
) implements Serializable {

    public Action {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public String stringArgument(String key) {
        Object value = arguments.get(key);
        return value != null ? String.valueOf(value) : null;
    }
}
