package com.hivemind.core.monitor;

import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.planning.TaskGraph;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes progress, blocking issues and a completion estimate for one objective.
 * <p>
 * A pure function of the task graph, the agents and the supplied clock reading: calling it
 * twice without an intervening state change yields the same percentages and issues.
 */
@Service
public class ProgressMonitor {

    private final Duration staleThreshold;
    private final Duration gracePeriod;
    private final Duration defaultEstimate;
    private final Duration maxEstimate;

    @Autowired
    public ProgressMonitor(HivemindProperties properties) {
        this(properties.getStaleTaskThreshold(), properties.getStaleGracePeriod(),
                properties.getDefaultEstimate(), properties.getMaxEstimate());
    }

    ProgressMonitor(Duration staleThreshold, Duration gracePeriod, Duration defaultEstimate, Duration maxEstimate) {
        this.staleThreshold = staleThreshold;
        this.gracePeriod = gracePeriod;
        this.defaultEstimate = defaultEstimate;
        this.maxEstimate = maxEstimate;
    }

    public ProgressReport report(TaskGraph graph, Collection<Agent> agents, Instant objectiveStart, Instant now) {
        List<Task> tasks = graph.effectiveTasks();
        double overall = ratio(tasks);

        Map<String, Double> byAgent = new LinkedHashMap<>();
        for (Agent agent : agents) {
            List<Task> own = graph.tasksAssignedTo(agent.id()).stream()
                    .filter(t -> !graph.isSuperseded(t.id()))
                    .toList();
            byAgent.put(agent.id(), ratio(own));
        }

        return new ProgressReport(graph.objectiveId(), overall, byAgent,
                blockingIssues(graph, now), estimateCompletion(overall, objectiveStart, now));
    }

    List<String> blockingIssues(TaskGraph graph, Instant now) {
        var issues = new ArrayList<String>();
        for (Task task : graph.effectiveTasks()) {
            switch (task.status()) {
                case PENDING -> {
                    int incomplete = graph.incompleteDependencies(task.id()).size();
                    if (incomplete > 0) {
                        issues.add("Task \"%s\" blocked by %d incomplete %s"
                                .formatted(task.content(), incomplete, incomplete == 1 ? "dependency" : "dependencies"));
                    }
                    if (graph.isManual(task.id())) {
                        issues.add("Task \"%s\" awaits manual action".formatted(task.content()));
                    } else if (graph.assigneeOf(task.id()).isEmpty()) {
                        issues.add("Task \"%s\" has no assigned agent".formatted(task.content()));
                    }
                }
                case FAILED -> issues.add("Task \"%s\" failed: %s".formatted(task.content(),
                        task.failureReason() != null ? task.failureReason() : "unknown reason"));
                case CANCELLED -> issues.add("Task \"%s\" was cancelled".formatted(task.content()));
                case IN_PROGRESS -> {
                    if (isStale(task, now, staleThreshold)) {
                        long minutes = Duration.between(task.startedAt(), now).toMinutes();
                        issues.add("Task \"%s\" in progress for %d minutes without completing"
                                .formatted(task.content(), minutes));
                    }
                }
                case COMPLETED -> {
                }
            }
        }
        return issues;
    }

    /**
     * In-progress tasks that exceeded the stale threshold plus the grace period and should
     * be failed by the coordinator.
     */
    public List<Task> findReapableTasks(TaskGraph graph, Instant now) {
        Duration limit = staleThreshold.plus(gracePeriod);
        return graph.tasks().stream()
                .filter(t -> t.status() == TaskStatus.IN_PROGRESS)
                .filter(t -> isStale(t, now, limit))
                .toList();
    }

    Instant estimateCompletion(double progress, Instant objectiveStart, Instant now) {
        if (progress <= 0.0) {
            Duration estimate = defaultEstimate;
            if (estimate.compareTo(Duration.ofHours(1)) < 0) {
                estimate = Duration.ofHours(1);
            }
            if (estimate.compareTo(maxEstimate) > 0) {
                estimate = maxEstimate;
            }
            return now.plus(estimate);
        }
        long elapsedMs = Math.max(0, Duration.between(objectiveStart, now).toMillis());
        long totalMs = (long) (elapsedMs / progress * 100.0);
        return now.plusMillis(Math.max(0, totalMs - elapsedMs));
    }

    private static boolean isStale(Task task, Instant now, Duration limit) {
        return task.startedAt() != null && Duration.between(task.startedAt(), now).compareTo(limit) > 0;
    }

    private static double ratio(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return 0.0;
        }
        long completed = tasks.stream().filter(t -> t.status() == TaskStatus.COMPLETED).count();
        return completed * 100.0 / tasks.size();
    }
}
