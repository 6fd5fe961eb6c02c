package com.hivemind.core.nodes;

import com.hivemind.core.analysis.ObjectiveAnalyzer;
import com.hivemind.core.error.CoordinationException;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.state.IntakeState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Classifies the objective and derives its capability roster.
 */
@Component
public class AnalyzeObjectiveNode {

    private final ObjectiveAnalyzer analyzer;

    public AnalyzeObjectiveNode(ObjectiveAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public Map<String, Object> apply(IntakeState state) {
        var objective = state.objective()
                .orElseThrow(() -> new CoordinationException("Intake started without an objective for " + state.objectiveId()));
        TaskAnalysis analysis = analyzer.analyze(objective);
        return Map.of(
                "analysis", analysis,
                "status", ObjectiveStatus.ANALYZED.name(),
                "statusHistory", List.of(ObjectiveStatus.ANALYZED.name())
        );
    }
}
