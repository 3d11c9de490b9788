package com.recursa.core.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of the capability rules, loaded once per task.
 * <p>
 * The permitted actions of an agent are the union of the actions of every rule
 * whose level and agent match. The final action is always permitted.
 */
public final class CapabilityTable {

    static final String ANY_AGENT = "*";

    private final List<Grant> grants;
    private final String finalAction;

    private CapabilityTable(List<Grant> grants, String finalAction) {
        this.grants = grants;
        this.finalAction = finalAction;
    }

    public static CapabilityTable from(CapabilityProperties properties, String finalAction) {
        List<Grant> grants = new ArrayList<>();
        for (CapabilityProperties.Rule rule : properties.getRules()) {
            String agent = rule.getAgent() == null || rule.getAgent().isBlank() ? ANY_AGENT : rule.getAgent();
            List<String> actions = rule.getActions() == null ? List.of() : List.copyOf(rule.getActions());
            grants.add(new Grant(rule.getLevel(), agent, actions));
        }
        return new CapabilityTable(List.copyOf(grants), finalAction);
    }

    public boolean isPermitted(int level, String agentName, String actionName) {
        if (finalAction.equals(actionName)) {
            return true;
        }
        for (Grant grant : grants) {
            if (grant.matches(level, agentName) && grant.actions().contains(actionName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Permitted actions in rule order, final action last.
     */
    public Set<String> permittedActions(int level, String agentName) {
        Set<String> actions = new LinkedHashSet<>();
        for (Grant grant : grants) {
            if (grant.matches(level, agentName)) {
                actions.addAll(grant.actions());
            }
        }
        actions.remove(finalAction);
        actions.add(finalAction);
        return Collections.unmodifiableSet(actions);
    }

    public String finalAction() {
        return finalAction;
    }

    private record Grant(Integer level, String agent, List<String> actions) {
        boolean matches(int frameLevel, String agentName) {
            return (level == null || level == frameLevel)
                    && (ANY_AGENT.equals(agent) || agent.equals(agentName));
        }
    }
}
