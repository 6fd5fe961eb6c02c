package com.hivemind.core.assignment;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.planning.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assigns unassigned pending tasks to agents by keyword capability matching.
 * <p>
 * Two passes: tasks the execution plan routed to a role go to the first live agent of that
 * role; every remaining task is offered to agents in spawn order and the first agent whose
 * role keywords appear in the task content claims it. Tasks nobody matches stay unassigned.
 */
@Service
public class CapabilityMatcher {

    private static final Logger log = LoggerFactory.getLogger(CapabilityMatcher.class);

    /**
     * Most specific role for a task: the role whose longest contained keyword is longest.
     * Ties go to the role declared first.
     */
    public Optional<AgentRole> inferRole(Task task) {
        AgentRole best = null;
        int bestScore = 0;
        for (AgentRole role : AgentRole.values()) {
            int score = role.matchSpecificity(task.content());
            if (score > bestScore) {
                best = role;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Assigns tasks in {@code graph} and returns the new task-to-agent edges in queue order.
     *
     * @param agents agents in spawn order; only idle or active agents accept work
     * @param plan   optional plan whose role routing takes precedence, may be {@code null}
     */
    public Map<String, String> assign(TaskGraph graph, List<Agent> agents, ExecutionPlan plan) {
        List<Agent> available = agents.stream()
                .filter(a -> a.status() == AgentStatus.IDLE || a.status() == AgentStatus.ACTIVE)
                .toList();
        var assigned = new LinkedHashMap<String, String>();
        if (available.isEmpty()) {
            return assigned;
        }

        if (plan != null) {
            for (ExecutionPlan.Wave wave : plan.waves()) {
                for (ExecutionPlan.RoleAssignment routing : wave.assignments()) {
                    firstOfRole(available, routing.role()).ifPresent(agent -> {
                        for (String taskId : routing.taskIds()) {
                            if (isAssignable(graph, taskId)) {
                                graph.assign(taskId, agent.id());
                                assigned.put(taskId, agent.id());
                            }
                        }
                    });
                }
            }
        }

        for (Task task : graph.tasks()) {
            if (!isAssignable(graph, task.id())) {
                continue;
            }
            for (Agent agent : available) {
                if (agent.role().matches(task.content())) {
                    graph.assign(task.id(), agent.id());
                    assigned.put(task.id(), agent.id());
                    break;
                }
            }
        }

        log.info("Assigned {} tasks in objective {}", assigned.size(), graph.objectiveId());
        return assigned;
    }

    private static boolean isAssignable(TaskGraph graph, String taskId) {
        return graph.find(taskId)
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> graph.assigneeOf(taskId).isEmpty())
                .filter(t -> !graph.isManual(taskId))
                .isPresent();
    }

    private static Optional<Agent> firstOfRole(Collection<Agent> agents, AgentRole role) {
        return agents.stream().filter(a -> a.role() == role).findFirst();
    }
}
