package com.hivemind.core.engine;

import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.planning.TaskGraph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the coordinator owns for one objective: its analysis, task graph, agents,
 * last execution plan and lifecycle state. Arenas never share state with each other.
 */
public class ObjectiveArena {

    private final Objective objective;
    private final TaskAnalysis analysis;
    private final TaskGraph graph;
    private final Instant createdAt;
    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final List<ObjectiveStatus> history = new ArrayList<>();
    private final Set<String> remediated = new HashSet<>();
    private final Map<String, List<String>> blockedAttempts = new HashMap<>();
    private ObjectiveStatus status;
    private ExecutionPlan lastPlan;
    private boolean cancelled;
    private int waveCount;

    ObjectiveArena(Objective objective, TaskAnalysis analysis, TaskGraph graph,
                   List<ObjectiveStatus> intakeHistory, Instant createdAt) {
        this.objective = objective;
        this.analysis = analysis;
        this.graph = graph;
        this.createdAt = createdAt;
        this.status = ObjectiveStatus.SUBMITTED;
        history.add(ObjectiveStatus.SUBMITTED);
        for (ObjectiveStatus next : intakeHistory) {
            if (next != ObjectiveStatus.SPAWNING) {
                transition(next);
            }
        }
    }

    public String id() {
        return objective.id();
    }

    public Objective objective() {
        return objective;
    }

    public TaskAnalysis analysis() {
        return analysis;
    }

    public TaskGraph graph() {
        return graph;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ObjectiveStatus status() {
        return status;
    }

    public List<ObjectiveStatus> history() {
        return List.copyOf(history);
    }

    public Optional<ExecutionPlan> lastPlan() {
        return Optional.ofNullable(lastPlan);
    }

    void recordPlan(ExecutionPlan plan) {
        this.lastPlan = plan;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void transition(ObjectiveStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(objective.id(), status, next);
        }
        if (status != next) {
            history.add(next);
        }
        status = next;
        if (next == ObjectiveStatus.CANCELLED) {
            cancelled = true;
        }
    }

    // -- Agents --

    public List<Agent> agents() {
        return List.copyOf(agents.values());
    }

    public List<Agent> liveAgents() {
        return agents.values().stream().filter(a -> a.status().isLive()).toList();
    }

    public Optional<Agent> agent(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    void putAgent(Agent agent) {
        agents.put(agent.id(), agent);
    }

    void updateAgentStatus(String agentId, AgentStatus newStatus) {
        Agent agent = agents.get(agentId);
        if (agent != null && agent.status() != newStatus) {
            agents.put(agentId, agent.withStatus(newStatus));
        }
    }

    // -- Remediation bookkeeping --

    boolean wasRemediated(String key) {
        return remediated.contains(key);
    }

    void markRemediated(String key) {
        remediated.add(key);
    }

    /** Options already tried for a blocked agent, oldest first. */
    List<String> attemptsFor(String agentId) {
        return List.copyOf(blockedAttempts.getOrDefault(agentId, List.of()));
    }

    void recordAttempt(String agentId, String option) {
        blockedAttempts.computeIfAbsent(agentId, k -> new ArrayList<>()).add(option);
    }

    int nextWaveNumber() {
        return ++waveCount;
    }

    public int waveCount() {
        return waveCount;
    }
}
