package com.recursa.core.tools;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Executes non-agent actions. Implementations own their own retry policy.
 */
public interface ToolCollaborator {

    /**
     * @return the result payload
     * @throws ToolExecutionException when the tool reports a failure
     */
    String execute(String actionName, Map<String, Object> arguments, Path workspaceRoot);

    /**
     * Human-readable description of a tool, shown to the model when known.
     */
    default Optional<String> describe(String actionName) {
        return Optional.empty();
    }
}
