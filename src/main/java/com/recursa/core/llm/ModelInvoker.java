package com.recursa.core.llm;

import com.recursa.core.context.Prompt;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionSchema;

import java.util.List;

/**
 * Asks the model for the next action(s) of an agent.
 */
public interface ModelInvoker {

    /**
     * @param prompt            the assembled decision prompt
     * @param permittedActions  actions the agent may choose from
     * @return a non-empty ordered list of actions
     * @throws TransientModelException      when the call may succeed on retry
     * @throws MalformedModelOutputException when the answer cannot be parsed into actions
     * @throws ModelAuthorizationException  when credentials are rejected
     */
    List<Action> invoke(Prompt prompt, List<ActionSchema> permittedActions);
}
