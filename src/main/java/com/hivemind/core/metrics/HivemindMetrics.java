package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for objective coordination.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysisDuration(String taskType, long ms) {
        Timer.builder("hivemind.analysis.duration")
                .tag("type", taskType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordObjectiveResult(String status) {
        Counter.builder("hivemind.objectives.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAgentSpawned(String role, boolean specialist) {
        Counter.builder("hivemind.agents.spawned")
                .tag("role", role)
                .tag("kind", specialist ? "specialist" : "core")
                .register(registry)
                .increment();
    }

    public void recordPlan(String strategy, int waveCount) {
        Counter.builder("hivemind.plans.total")
                .tag("strategy", strategy)
                .register(registry)
                .increment();
        DistributionSummary.builder("hivemind.plan.waves")
                .register(registry)
                .record(waveCount);
    }

    public void recordWaveExecution(int taskCount, long ms) {
        Timer.builder("hivemind.wave.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("hivemind.wave.size")
                .description("Tasks dispatched per wave")
                .register(registry)
                .record(taskCount);
    }

    public void recordTaskOutcome(String outcome) {
        Counter.builder("hivemind.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordDecision(double confidence) {
        Counter.builder("hivemind.decisions.total")
                .register(registry)
                .increment();
        DistributionSummary.builder("hivemind.decision.confidence")
                .register(registry)
                .record(confidence);
    }

    /**
     * Records how a permission failure was handled.
     *
     * @param automatic true when a retry was scheduled without human involvement
     */
    public void recordRemediation(boolean automatic) {
        Counter.builder("hivemind.remediations.total")
                .tag("mode", automatic ? "automatic" : "manual")
                .register(registry)
                .increment();
    }

    public void incrementStaleTasks() {
        Counter.builder("hivemind.tasks.stale")
                .description("Tasks reaped after exceeding the stale threshold and grace period")
                .register(registry)
                .increment();
    }
}
