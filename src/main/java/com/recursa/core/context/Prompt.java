package com.recursa.core.context;

/**
 * A decision prompt ready for the model.
 *
 * @param systemPrompt    instructions plus all tagged context sections
 * @param userMessage     the fixed request for the next action
 * @param includedEntries rendered entries included in the prompt
 * @param droppedEntries  oldest rendered entries left out by the size cap
 */
public record Prompt(
    String systemPrompt,
    String userMessage,
    int includedEntries,
    int droppedEntries
) {
}
