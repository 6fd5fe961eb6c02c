package com.hivemind.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ProgressReport(
        String objectiveId,
        double overallProgress,
        Map<String, Double> agentProgress,
        List<String> blockingIssues,
        Instant estimatedCompletion
) {

    public ProgressReport {
        agentProgress = Map.copyOf(agentProgress);
        blockingIssues = List.copyOf(blockingIssues);
    }

    public boolean isComplete() {
        return overallProgress >= 100.0;
    }
}
