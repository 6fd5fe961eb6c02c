package com.hivemind.core.nodes;

import com.hivemind.core.error.CoordinationException;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.planning.TaskGraph;
import com.hivemind.core.planning.TaskGraphBuilder;
import com.hivemind.core.state.IntakeState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class BuildTaskGraphNode {

    private final TaskGraphBuilder builder;

    public BuildTaskGraphNode(TaskGraphBuilder builder) {
        this.builder = builder;
    }

    public Map<String, Object> apply(IntakeState state) {
        var objective = state.objective()
                .orElseThrow(() -> new CoordinationException("No objective in intake state for " + state.objectiveId()));
        var analysis = state.analysis()
                .orElseThrow(() -> new CoordinationException("Task graph requested before analysis for " + state.objectiveId()));
        TaskGraph graph = builder.build(objective, analysis);
        return Map.of(
                "taskGraph", graph,
                "status", ObjectiveStatus.GRAPH_BUILT.name(),
                "statusHistory", List.of(ObjectiveStatus.GRAPH_BUILT.name())
        );
    }
}
