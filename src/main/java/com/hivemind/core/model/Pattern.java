package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Historical record of how a task type was handled: which roles ran, how often it
 * succeeded and how long it took.
 */
public record Pattern(
        String taskType,
        List<AgentRole> agentSequence,
        double successRate,
        long avgDurationMs,
        Instant lastUsed,
        int useCount
) implements Serializable {

    public Pattern {
        agentSequence = agentSequence != null ? List.copyOf(agentSequence) : List.of();
        successRate = Math.max(0.0, Math.min(1.0, successRate));
    }
}
