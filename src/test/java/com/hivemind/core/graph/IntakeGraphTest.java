package com.hivemind.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.analysis.ObjectiveAnalyzer;
import com.hivemind.core.assignment.CapabilityMatcher;
import com.hivemind.core.memory.InMemoryPatternStore;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.ExecutionStrategy;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.TaskType;
import com.hivemind.core.nodes.AnalyzeObjectiveNode;
import com.hivemind.core.nodes.BuildTaskGraphNode;
import com.hivemind.core.nodes.PlanExecutionNode;
import com.hivemind.core.planning.TaskGraphBuilder;
import com.hivemind.core.scheduler.ParallelizationPlanner;
import com.hivemind.core.state.IntakeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntakeGraphTest {

    private static final String WIDGET = "create a widget to show open incidents with a chart";

    private IntakeGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        var store = new InMemoryPatternStore(new ObjectMapper().findAndRegisterModules(), 100, 5);
        graph = new IntakeGraph(
                new AnalyzeObjectiveNode(new ObjectiveAnalyzer(store)),
                new BuildTaskGraphNode(new TaskGraphBuilder()),
                new PlanExecutionNode(new ParallelizationPlanner(new CapabilityMatcher())));
    }

    @Test
    @DisplayName("auto-spawn intake analyzes, builds the graph and plans execution")
    void autoSpawn() {
        IntakeState state = graph.run(Objective.of("OBJ-1", WIDGET), true, 8);

        assertEquals(ObjectiveStatus.SPAWNING, state.status());
        assertEquals(List.of("ANALYZED", "GRAPH_BUILT", "SPAWNING"), state.statusHistory());
        assertEquals(TaskType.INTERACTIVE_COMPONENT, state.analysis().orElseThrow().type());
        assertEquals(8, state.taskGraph().orElseThrow().size());

        var plan = state.executionPlan().orElseThrow();
        assertEquals(ExecutionStrategy.PARALLEL, plan.strategy());
        assertTrue(plan.rolesToSpawn().contains(AgentRole.RESEARCHER));
    }

    @Test
    @DisplayName("without auto-spawn intake stops after building the graph")
    void manualSpawn() {
        IntakeState state = graph.run(Objective.of("OBJ-2", WIDGET), false, 8);

        assertEquals(ObjectiveStatus.GRAPH_BUILT, state.status());
        assertEquals(List.of("ANALYZED", "GRAPH_BUILT"), state.statusHistory());
        assertTrue(state.executionPlan().isEmpty());
        assertEquals("OBJ-2", state.taskGraph().orElseThrow().objectiveId());
    }

    @Test
    @DisplayName("routing follows the auto-spawn flag")
    void routing() {
        assertEquals("plan_execution", graph.routeAfterBuild(new IntakeState(Map.of("autoSpawn", true))));
        assertEquals("done", graph.routeAfterBuild(new IntakeState(Map.of("autoSpawn", false))));
        assertEquals("done", graph.routeAfterBuild(new IntakeState(Map.of())));
    }

    @Test
    @DisplayName("the compiled graph is exposed")
    void compiled() {
        assertNotNull(graph.getCompiledGraph());
    }
}
