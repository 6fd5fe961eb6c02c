package com.hivemind.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Result of classifying an objective.
 *
 * @param type                 the classified task type
 * @param requiredCapabilities roster of roles, researcher first, in spawn order
 * @param estimatedComplexity  heuristic complexity in {@code [1, 10]}
 * @param dependencies         domain dependencies detected in the description
 * @param suggestedPattern     best historical pattern for the type, may be {@code null}
 */
public record TaskAnalysis(
        TaskType type,
        List<AgentRole> requiredCapabilities,
        int estimatedComplexity,
        List<String> dependencies,
        Pattern suggestedPattern
) implements Serializable {

    public TaskAnalysis {
        requiredCapabilities = requiredCapabilities != null ? List.copyOf(requiredCapabilities) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public Optional<Pattern> suggested() {
        return Optional.ofNullable(suggestedPattern);
    }
}
