package com.recursa.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task and frame execution.
 */
@Service
public class RecursaMetrics {

    private final MeterRegistry registry;

    public RecursaMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskResult(String status) {
        Counter.builder("recursa.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordFrameDuration(String agentName, String status, long ms) {
        Timer.builder("recursa.frame.duration")
                .tag("agent", agentName)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAction(String kind, boolean failed) {
        Counter.builder("recursa.actions.total")
                .tag("kind", kind)
                .tag("failed", String.valueOf(failed))
                .register(registry)
                .increment();
    }

    public void recordConsolidation(boolean degraded) {
        Counter.builder("recursa.consolidations.total")
                .tag("result", degraded ? "degraded" : "ok")
                .register(registry)
                .increment();
    }

    public void recordCapabilityViolation(String agentName) {
        Counter.builder("recursa.capability.violations")
                .tag("agent", agentName)
                .register(registry)
                .increment();
    }

    /**
     * Incremented once per transient model error that is retried.
     */
    public void recordModelRetry() {
        Counter.builder("recursa.model.retries")
                .description("Model calls retried after a transient error")
                .register(registry)
                .increment();
    }

    public void recordMalformedOutput() {
        Counter.builder("recursa.model.malformed")
                .register(registry)
                .increment();
    }

    public void recordStackDepth(int depth) {
        DistributionSummary.builder("recursa.stack.depth")
                .register(registry)
                .record(depth);
    }
}
