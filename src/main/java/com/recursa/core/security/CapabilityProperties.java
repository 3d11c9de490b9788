package com.recursa.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Capability rules granting actions to agents by hierarchy level and name.
 * Anything not granted by some rule is denied.
 */
@Component
@ConfigurationProperties(prefix = "recursa.capabilities")
public class CapabilityProperties {

    private List<Rule> rules = new ArrayList<>();

    public List<Rule> getRules() {
        return rules;
    }

    public void setRules(List<Rule> rules) {
        this.rules = rules;
    }

    public static class Rule {
        /** Hierarchy level the rule applies to; {@code null} matches every level. */
        private Integer level;
        /** Agent name, or {@code *} for any agent. */
        private String agent = "*";
        private List<String> actions = new ArrayList<>();

        public Rule() {}

        public Rule(Integer level, String agent, List<String> actions) {
            this.level = level;
            this.agent = agent;
            this.actions = actions;
        }

        public Integer getLevel() {
            return level;
        }

        public void setLevel(Integer level) {
            this.level = level;
        }

        public String getAgent() {
            return agent;
        }

        public void setAgent(String agent) {
            this.agent = agent;
        }

        public List<String> getActions() {
            return actions;
        }

        public void setActions(List<String> actions) {
            this.actions = actions;
        }
    }
}
