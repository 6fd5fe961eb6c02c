package com.hivemind.core.scheduler;

import com.hivemind.core.assignment.CapabilityMatcher;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.ExecutionStrategy;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.planning.TaskGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides between sequential and parallel spawning by simulating waves over the task graph.
 * <p>
 * Each simulated wave takes the ready frontier, groups it by the most specific matching
 * role and packs roles greedily up to the concurrency cap; overflow roles wait for the next
 * wave. Packed tasks count as completed for the following wave, so a task only enters a
 * wave after all its dependencies were planned in earlier waves. If no wave ever holds two
 * roles the plan is sequential and spawning follows the analyzer roster.
 */
@Service
public class ParallelizationPlanner {

    private static final Logger log = LoggerFactory.getLogger(ParallelizationPlanner.class);

    private final CapabilityMatcher capabilityMatcher;

    public ParallelizationPlanner(CapabilityMatcher capabilityMatcher) {
        this.capabilityMatcher = capabilityMatcher;
    }

    public ExecutionPlan plan(TaskGraph graph, TaskAnalysis analysis,
                              Collection<Agent> liveAgents, int maxConcurrentAgents) {
        int cap = Math.max(1, maxConcurrentAgents);

        List<ExecutionPlan.Wave> waves = simulateWaves(graph, cap);
        boolean parallel = waves.stream().anyMatch(w -> w.assignments().size() >= 2);
        ExecutionStrategy strategy = parallel ? ExecutionStrategy.PARALLEL : ExecutionStrategy.SEQUENTIAL;
        if (!parallel) {
            waves = simulateWaves(graph, 1);
        }

        Set<String> planned = new HashSet<>();
        waves.forEach(w -> w.assignments().forEach(a -> planned.addAll(a.taskIds())));
        List<String> unplanned = graph.tasks().stream()
                .filter(t -> !t.status().isTerminal())
                .map(Task::id)
                .filter(id -> !graph.isManual(id))
                .filter(id -> !planned.contains(id))
                .toList();

        List<AgentRole> toSpawn = rolesToSpawn(strategy, analysis, waves, liveAgents, cap);

        log.info("Plan for {}: strategy={}, {} waves, spawn {}, {} unplanned",
                graph.objectiveId(), strategy, waves.size(), toSpawn.stream().map(AgentRole::tag).toList(),
                unplanned.size());
        return new ExecutionPlan(strategy, waves, toSpawn, unplanned);
    }

    /**
     * Computes the next wave over the simulated completion set.
     *
     * @param simulatedDone ids treated as completed (really completed or planned earlier)
     * @param maxRoles      roles allowed in the wave (1 for sequential plans)
     * @return role routings for the wave; empty when nothing can be planned
     */
    List<ExecutionPlan.RoleAssignment> computeNextWave(TaskGraph graph, Set<String> simulatedDone, int maxRoles) {
        Map<AgentRole, List<String>> byRole = new LinkedHashMap<>();
        for (Task task : graph.tasks()) {
            if (simulatedDone.contains(task.id()) || task.status().isTerminal() || graph.isManual(task.id())) {
                continue;
            }
            if (!simulatedDone.containsAll(graph.dependenciesOf(task.id()))) {
                log.debug("  {} deps unsatisfied: {}", task.id(), graph.dependenciesOf(task.id()));
                continue;
            }
            Optional<AgentRole> role = capabilityMatcher.inferRole(task);
            if (role.isEmpty()) {
                log.debug("  {} matches no role, left unplanned", task.id());
                continue;
            }
            byRole.computeIfAbsent(role.get(), r -> new ArrayList<>()).add(task.id());
        }

        var wave = new ArrayList<ExecutionPlan.RoleAssignment>();
        for (Map.Entry<AgentRole, List<String>> entry : byRole.entrySet()) {
            if (wave.size() >= maxRoles) {
                log.debug("  role {} deferred to next wave (cap {})", entry.getKey().tag(), maxRoles);
                continue;
            }
            wave.add(new ExecutionPlan.RoleAssignment(entry.getKey(), entry.getValue()));
        }
        return wave;
    }

    private List<ExecutionPlan.Wave> simulateWaves(TaskGraph graph, int maxRoles) {
        Set<String> simulatedDone = new HashSet<>();
        for (Task task : graph.tasks()) {
            if (task.status() == TaskStatus.COMPLETED) {
                simulatedDone.add(task.id());
            }
        }

        var waves = new ArrayList<ExecutionPlan.Wave>();
        while (true) {
            List<ExecutionPlan.RoleAssignment> next = computeNextWave(graph, simulatedDone, maxRoles);
            if (next.isEmpty()) {
                break;
            }
            waves.add(new ExecutionPlan.Wave(waves.size() + 1, next));
            next.forEach(a -> simulatedDone.addAll(a.taskIds()));
        }
        return waves;
    }

    private List<AgentRole> rolesToSpawn(ExecutionStrategy strategy, TaskAnalysis analysis,
                                         List<ExecutionPlan.Wave> waves, Collection<Agent> liveAgents, int cap) {
        var candidates = new LinkedHashSet<AgentRole>(analysis.requiredCapabilities());
        if (strategy == ExecutionStrategy.PARALLEL) {
            waves.forEach(w -> candidates.addAll(w.roles()));
        }
        Set<AgentRole> liveRoles = new HashSet<>();
        liveAgents.forEach(a -> liveRoles.add(a.role()));

        int capacity = Math.max(0, cap - liveAgents.size());
        return candidates.stream()
                .filter(role -> !liveRoles.contains(role))
                .limit(capacity)
                .toList();
    }
}
