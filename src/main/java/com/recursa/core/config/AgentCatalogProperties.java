package com.recursa.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Agents that can be run as the root or spawned as children, keyed by agent name.
 */
@Component
@ConfigurationProperties(prefix = "recursa")
public class AgentCatalogProperties {

    private Map<String, Agent> agents = new LinkedHashMap<>();

    public Map<String, Agent> getAgents() {
        return agents;
    }

    public void setAgents(Map<String, Agent> agents) {
        this.agents = agents;
    }

    public static class Agent {
        private String description = "";
        private String instructions = "";

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getInstructions() {
            return instructions;
        }

        public void setInstructions(String instructions) {
            this.instructions = instructions;
        }
    }
}
