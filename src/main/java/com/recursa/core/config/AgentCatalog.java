package com.recursa.core.config;

import com.recursa.core.model.AgentDefinition;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of configured agent definitions.
 * <p>
 * An action whose name is in the catalog spawns a child agent; any other
 * non-final action goes to the tool backend.
 */
@Component
public class AgentCatalog {

    static final String DEFAULT_INSTRUCTIONS = "You are an autonomous agent. Work step by step toward the task "
            + "in <task_input>, using one of the permitted actions each time.";

    private final Map<String, AgentDefinition> definitions;

    @Autowired
    public AgentCatalog(AgentCatalogProperties properties) {
        this(toDefinitions(properties));
    }

    public AgentCatalog(List<AgentDefinition> definitions) {
        Map<String, AgentDefinition> byName = new LinkedHashMap<>();
        for (AgentDefinition d : definitions) {
            byName.put(d.name(), d);
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public boolean isAgent(String name) {
        return definitions.containsKey(name);
    }

    public Optional<AgentDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * Definition for {@code name}, or a generic one when the agent is not configured.
     */
    public AgentDefinition definitionFor(String name) {
        AgentDefinition d = definitions.get(name);
        return d != null ? d : new AgentDefinition(name, "", DEFAULT_INSTRUCTIONS);
    }

    public List<AgentDefinition> all() {
        return new ArrayList<>(definitions.values());
    }

    private static List<AgentDefinition> toDefinitions(AgentCatalogProperties properties) {
        List<AgentDefinition> result = new ArrayList<>();
        properties.getAgents().forEach((name, agent) ->
                result.add(new AgentDefinition(name, agent.getDescription(), agent.getInstructions())));
        return result;
    }
}
