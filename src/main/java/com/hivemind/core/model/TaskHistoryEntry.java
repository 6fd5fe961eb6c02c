package com.hivemind.core.model;

import java.time.Instant;
import java.util.List;

/**
 * One finished objective, recorded for success-rate learning.
 */
public record TaskHistoryEntry(
        String objectiveId,
        String objective,
        String taskType,
        List<AgentRole> agentsUsed,
        boolean success,
        long durationMs,
        Instant completedAt
) {

    public TaskHistoryEntry {
        agentsUsed = agentsUsed != null ? List.copyOf(agentsUsed) : List.of();
    }
}
