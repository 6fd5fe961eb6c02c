package com.hivemind.core.model;

public record CoordinatorStatus(
        int activeObjectives,
        int activeAgents,
        int totalTasks,
        int completedTasks,
        PatternStoreStats memory
) {
}
