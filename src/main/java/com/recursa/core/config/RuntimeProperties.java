package com.recursa.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Limits and defaults for the turn loop, consolidation and model calls.
 */
@Component
@ConfigurationProperties(prefix = "recursa.runtime")
public class RuntimeProperties {

    private String rootAgent = "main_agent";
    private String finalAction = "final_output";
    private int maxTurns = 100;
    private int maxDepth = 5;
    private int consolidationInterval = 10;
    /** Per-level overrides of {@link #consolidationInterval}, keyed by hierarchy level. */
    private Map<Integer, Integer> consolidationIntervalByLevel = new HashMap<>();
    private int maxMalformedRetries = 3;
    private int maxConsolidationRetries = 2;
    private int maxConsecutiveViolations = 3;
    private int renderedHistoryMaxEntries = 50;
    private int renderedHistoryMaxChars = 60_000;
    private int actionResultMaxChars = 4_000;
    private boolean initialPlanning = true;
    private String workspaceRoot = System.getProperty("user.dir");
    private Duration modelCallTimeout = Duration.ofSeconds(120);
    private ModelRetry modelRetry = new ModelRetry();

    /**
     * Consolidation interval for a hierarchy level, falling back to the global value.
     */
    public int consolidationIntervalFor(int level) {
        Integer override = consolidationIntervalByLevel.get(level);
        int interval = override != null ? override : consolidationInterval;
        return Math.max(1, interval);
    }

    public String getRootAgent() {
        return rootAgent;
    }

    public void setRootAgent(String rootAgent) {
        this.rootAgent = rootAgent;
    }

    public String getFinalAction() {
        return finalAction;
    }

    public void setFinalAction(String finalAction) {
        this.finalAction = finalAction;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getConsolidationInterval() {
        return consolidationInterval;
    }

    public void setConsolidationInterval(int consolidationInterval) {
        this.consolidationInterval = consolidationInterval;
    }

    public Map<Integer, Integer> getConsolidationIntervalByLevel() {
        return consolidationIntervalByLevel;
    }

    public void setConsolidationIntervalByLevel(Map<Integer, Integer> consolidationIntervalByLevel) {
        this.consolidationIntervalByLevel = consolidationIntervalByLevel;
    }

    public int getMaxMalformedRetries() {
        return maxMalformedRetries;
    }

    public void setMaxMalformedRetries(int maxMalformedRetries) {
        this.maxMalformedRetries = maxMalformedRetries;
    }

    public int getMaxConsolidationRetries() {
        return maxConsolidationRetries;
    }

    public void setMaxConsolidationRetries(int maxConsolidationRetries) {
        this.maxConsolidationRetries = maxConsolidationRetries;
    }

    public int getMaxConsecutiveViolations() {
        return maxConsecutiveViolations;
    }

    public void setMaxConsecutiveViolations(int maxConsecutiveViolations) {
        this.maxConsecutiveViolations = maxConsecutiveViolations;
    }

    public int getRenderedHistoryMaxEntries() {
        return renderedHistoryMaxEntries;
    }

    public void setRenderedHistoryMaxEntries(int renderedHistoryMaxEntries) {
        this.renderedHistoryMaxEntries = renderedHistoryMaxEntries;
    }

    public int getRenderedHistoryMaxChars() {
        return renderedHistoryMaxChars;
    }

    public void setRenderedHistoryMaxChars(int renderedHistoryMaxChars) {
        this.renderedHistoryMaxChars = renderedHistoryMaxChars;
    }

    public int getActionResultMaxChars() {
        return actionResultMaxChars;
    }

    public void setActionResultMaxChars(int actionResultMaxChars) {
        this.actionResultMaxChars = actionResultMaxChars;
    }

    public boolean isInitialPlanning() {
        return initialPlanning;
    }

    public void setInitialPlanning(boolean initialPlanning) {
        this.initialPlanning = initialPlanning;
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public Duration getModelCallTimeout() {
        return modelCallTimeout;
    }

    public void setModelCallTimeout(Duration modelCallTimeout) {
        this.modelCallTimeout = modelCallTimeout;
    }

    public ModelRetry getModelRetry() {
        return modelRetry;
    }

    public void setModelRetry(ModelRetry modelRetry) {
        this.modelRetry = modelRetry;
    }

    public static class ModelRetry {
        private int maxAttempts = 4;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }
}
