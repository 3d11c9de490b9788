package com.recursa.core.model;

import java.util.List;

/**
 * Describes one permitted action to the model.
 *
 * @param name        action name
 * @param description what the action does
 * @param parameters  expected argument names
 * @param kind        TOOL, AGENT or FINAL
 */
public record ActionSchema(
    String name,
    String description,
    List<String> parameters,
    Kind kind
) {

    public enum Kind { TOOL, AGENT, FINAL }

    public ActionSchema {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
