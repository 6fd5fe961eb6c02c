package com.hivemind.core.graph;

import com.hivemind.core.error.CoordinationException;
import com.hivemind.core.model.Objective;
import com.hivemind.core.nodes.AnalyzeObjectiveNode;
import com.hivemind.core.nodes.BuildTaskGraphNode;
import com.hivemind.core.nodes.PlanExecutionNode;
import com.hivemind.core.state.IntakeState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for objective intake.
 * <pre>
 *   START -> analyze_objective -> build_task_graph -> [routeAfterBuild]
 *            -> plan_execution -> END   (auto-spawn)
 *            -> END                     (caller spawns later)
 * </pre>
 */
@Component
public class IntakeGraph {

    private static final Logger log = LoggerFactory.getLogger(IntakeGraph.class);

    private final CompiledGraph<IntakeState> compiledGraph;

    public IntakeGraph(AnalyzeObjectiveNode analyzeNode,
                       BuildTaskGraphNode buildNode,
                       PlanExecutionNode planNode) throws Exception {

        var graph = new StateGraph<>(IntakeState.SCHEMA, IntakeState::new)
                .addNode("analyze_objective", node_async(analyzeNode::apply))
                .addNode("build_task_graph", node_async(buildNode::apply))
                .addNode("plan_execution", node_async(planNode::apply))
                .addEdge(START, "analyze_objective")
                .addEdge("analyze_objective", "build_task_graph")
                .addConditionalEdges("build_task_graph",
                        edge_async(this::routeAfterBuild),
                        Map.of("plan_execution", "plan_execution",
                                "done", END))
                .addEdge("plan_execution", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Intake graph compiled");
    }

    String routeAfterBuild(IntakeState state) {
        return state.autoSpawn() ? "plan_execution" : "done";
    }

    /**
     * Runs intake for one objective and returns the final state.
     */
    public IntakeState run(Objective objective, boolean autoSpawn, int maxConcurrentAgents) {
        var stateMap = new HashMap<String, Object>();
        stateMap.put("objectiveId", objective.id());
        stateMap.put("objective", objective);
        stateMap.put("autoSpawn", autoSpawn);
        stateMap.put("maxConcurrentAgents", maxConcurrentAgents);

        var config = RunnableConfig.builder()
                .threadId(objective.id())
                .build();

        return compiledGraph.invoke(Map.copyOf(stateMap), config)
                .orElseThrow(() -> new CoordinationException(
                        "Intake graph returned empty state for objective " + objective.id()));
    }

    public CompiledGraph<IntakeState> getCompiledGraph() {
        return compiledGraph;
    }
}
