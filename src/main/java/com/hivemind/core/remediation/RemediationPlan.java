package com.hivemind.core.remediation;

import com.hivemind.core.model.Task;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tasks to prepend after a permission failure.
 *
 * @param automatic    true when the retry can proceed without a human fixing permissions first
 * @param tasks        tasks in queue order, manual actions before the retry
 * @param dependencies dependencies among the new tasks
 * @param retryTaskId  id of the retry task that replaces the failed work
 */
public record RemediationPlan(
        boolean automatic,
        List<Task> tasks,
        Map<String, Set<String>> dependencies,
        String retryTaskId
) {

    /** Ids of the operator-only tasks; empty for an automatic plan. */
    public List<String> manualTaskIds() {
        return tasks.stream()
                .map(Task::id)
                .filter(id -> !id.equals(retryTaskId))
                .toList();
    }

    public List<String> manualActions() {
        return tasks.stream()
                .filter(t -> !t.id().equals(retryTaskId))
                .map(Task::content)
                .toList();
    }
}
