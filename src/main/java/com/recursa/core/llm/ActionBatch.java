package com.recursa.core.llm;

import java.util.List;
import java.util.Map;

/**
 * Structured model answer: the ordered actions to execute this turn.
 *
 * @param thinking brief reasoning behind the choice (logged, not executed)
 * @param actions  actions in execution order
 */
public record ActionBatch(
    String thinking,
    List<Call> actions
) {

    /**
     * @param name      action name, one of the permitted actions
     * @param arguments named arguments for the action
     */
    public record Call(String name, Map<String, Object> arguments) {}
}
