package com.hivemind.core.nodes;

import com.hivemind.core.error.CoordinationException;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.scheduler.ParallelizationPlanner;
import com.hivemind.core.state.IntakeState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Previews the execution plan when the objective is submitted in auto-spawn mode.
 * No agents exist yet, so the plan reflects the full roster.
 */
@Component
public class PlanExecutionNode {

    private final ParallelizationPlanner planner;

    public PlanExecutionNode(ParallelizationPlanner planner) {
        this.planner = planner;
    }

    public Map<String, Object> apply(IntakeState state) {
        var graph = state.taskGraph()
                .orElseThrow(() -> new CoordinationException("Planning requested before the task graph for " + state.objectiveId()));
        var analysis = state.analysis()
                .orElseThrow(() -> new CoordinationException("Planning requested before analysis for " + state.objectiveId()));
        ExecutionPlan plan = planner.plan(graph, analysis, List.of(), state.maxConcurrentAgents());
        return Map.of(
                "executionPlan", plan,
                "status", ObjectiveStatus.SPAWNING.name(),
                "statusHistory", List.of(ObjectiveStatus.SPAWNING.name())
        );
    }
}
