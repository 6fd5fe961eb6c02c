package com.hivemind.dispatch.api;

import com.hivemind.core.engine.ObjectiveArena;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.Task;
import com.hivemind.core.planning.TaskGraph;

import java.util.List;

/**
 * Snapshot of one objective for REST clients.
 */
public record ObjectiveResponse(
        String objectiveId,
        String description,
        String status,
        String type,
        int complexity,
        List<String> requiredCapabilities,
        String strategy,
        List<TaskView> tasks,
        List<AgentView> agents,
        List<String> history
) {

    public record TaskView(
            String id,
            String content,
            String status,
            String priority,
            String assignee,
            List<String> dependencies,
            boolean superseded,
            String failureReason
    ) {}

    public record AgentView(String id, String role, String status, boolean specialist) {}

    public static ObjectiveResponse from(ObjectiveArena arena) {
        TaskGraph graph = arena.graph();
        List<TaskView> tasks = graph.tasks().stream()
                .map(t -> taskView(graph, t))
                .toList();
        List<AgentView> agents = arena.agents().stream()
                .map(ObjectiveResponse::agentView)
                .toList();
        return new ObjectiveResponse(
                arena.id(),
                arena.objective().description(),
                arena.status().name(),
                arena.analysis().type().tag(),
                arena.analysis().estimatedComplexity(),
                arena.analysis().requiredCapabilities().stream().map(AgentRole::tag).toList(),
                arena.lastPlan().map(ExecutionPlan::strategy).map(Enum::name).orElse(null),
                tasks,
                agents,
                arena.history().stream().map(Enum::name).toList());
    }

    private static TaskView taskView(TaskGraph graph, Task task) {
        return new TaskView(task.id(), task.content(), task.status().name(), task.priority().name(),
                graph.assigneeOf(task.id()).orElse(null),
                List.copyOf(graph.dependenciesOf(task.id())),
                graph.isSuperseded(task.id()),
                task.failureReason());
    }

    private static AgentView agentView(Agent agent) {
        return new AgentView(agent.id(), agent.role().tag(), agent.status().name(), agent.isSpecialist());
    }
}
