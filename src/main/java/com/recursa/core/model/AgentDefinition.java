package com.recursa.core.model;

/**
 * A runnable agent: its name, what it is for, and the static instructions
 * placed at the head of every decision prompt.
 *
 * @param name         catalog key and spawn action name
 * @param description  one-line description shown to parent agents
 * @param instructions static system instructions
 */
public record AgentDefinition(
    String name,
    String description,
    String instructions
) {
}
