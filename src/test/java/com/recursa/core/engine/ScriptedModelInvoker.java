package com.recursa.core.engine;

import com.recursa.core.context.Prompt;
import com.recursa.core.llm.ModelInvoker;
import com.recursa.core.model.Action;
import com.recursa.core.model.ActionSchema;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model double that answers from a per-agent script. The agent is recognised by the
 * {@code name:} line of the identity section in the prompt.
 */
class ScriptedModelInvoker implements ModelInvoker {

    private static final Pattern AGENT_NAME = Pattern.compile("(?m)^name: (\\S+)$");

    private final Map<String, Deque<Function<Prompt, List<Action>>>> scripts = new HashMap<>();
    private final Map<String, Function<Prompt, List<Action>>> fallbacks = new HashMap<>();
    private final Map<String, List<Prompt>> prompts = new HashMap<>();
    private final Map<String, List<List<ActionSchema>>> schemas = new HashMap<>();

    static Action call(String name, Object... keyValues) {
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            args.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new Action(name, args);
    }

    Script script(String agentName) {
        return new Script(agentName);
    }

    List<Prompt> promptsFor(String agentName) {
        return prompts.getOrDefault(agentName, List.of());
    }

    List<List<ActionSchema>> schemasFor(String agentName) {
        return schemas.getOrDefault(agentName, List.of());
    }

    int callsFor(String agentName) {
        return promptsFor(agentName).size();
    }

    @Override
    public synchronized List<Action> invoke(Prompt prompt, List<ActionSchema> permittedActions) {
        Matcher m = AGENT_NAME.matcher(prompt.systemPrompt());
        if (!m.find()) {
            throw new AssertionError("Prompt has no agent identity");
        }
        String agent = m.group(1);
        prompts.computeIfAbsent(agent, k -> new ArrayList<>()).add(prompt);
        schemas.computeIfAbsent(agent, k -> new ArrayList<>()).add(permittedActions);

        Deque<Function<Prompt, List<Action>>> queue = scripts.get(agent);
        if (queue != null && !queue.isEmpty()) {
            return queue.poll().apply(prompt);
        }
        Function<Prompt, List<Action>> fallback = fallbacks.get(agent);
        if (fallback != null) {
            return fallback.apply(prompt);
        }
        throw new AssertionError("No scripted answer left for agent " + agent);
    }

    final class Script {

        private final String agent;

        private Script(String agent) {
            this.agent = agent;
        }

        Script then(Action... actions) {
            List<Action> answer = List.of(actions);
            return respond(prompt -> answer);
        }

        Script thenThrow(RuntimeException error) {
            return respond(prompt -> {
                throw error;
            });
        }

        Script respond(Function<Prompt, List<Action>> responder) {
            scripts.computeIfAbsent(agent, k -> new ArrayDeque<>()).add(responder);
            return this;
        }

        /** Answer used once the scripted steps are used up. */
        void otherwise(Action... actions) {
            List<Action> answer = List.of(actions);
            fallbacks.put(agent, prompt -> answer);
        }
    }
}
