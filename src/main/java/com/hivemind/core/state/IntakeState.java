package com.hivemind.core.state;

import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.planning.TaskGraph;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state for objective intake.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Every value stored here
 * must be {@link java.io.Serializable}: the graph copies state between nodes.
 */
public class IntakeState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("objectiveId",         Channels.base(() -> "")),
        Map.entry("objective",           Channels.base((Reducer<Objective>) null)),
        Map.entry("status",              Channels.base(() -> ObjectiveStatus.SUBMITTED.name())),
        Map.entry("analysis",            Channels.base((Reducer<TaskAnalysis>) null)),
        Map.entry("taskGraph",           Channels.base((Reducer<TaskGraph>) null)),
        Map.entry("executionPlan",       Channels.base((Reducer<ExecutionPlan>) null)),
        Map.entry("autoSpawn",           Channels.base(() -> false)),
        Map.entry("maxConcurrentAgents", Channels.base(() -> 8)),

        // Every status the intake passed through, in order
        Map.entry("statusHistory",       Channels.appender(ArrayList::new))
    );

    public IntakeState(Map<String, Object> initData) {
        super(initData);
    }

    public String objectiveId() {
        return this.<String>value("objectiveId").orElse("");
    }

    public Optional<Objective> objective() {
        return value("objective");
    }

    public ObjectiveStatus status() {
        return ObjectiveStatus.valueOf(this.<String>value("status").orElse(ObjectiveStatus.SUBMITTED.name()));
    }

    public Optional<TaskAnalysis> analysis() {
        return value("analysis");
    }

    public Optional<TaskGraph> taskGraph() {
        return value("taskGraph");
    }

    public Optional<ExecutionPlan> executionPlan() {
        return value("executionPlan");
    }

    public boolean autoSpawn() {
        return this.<Boolean>value("autoSpawn").orElse(false);
    }

    public int maxConcurrentAgents() {
        return this.<Integer>value("maxConcurrentAgents").orElse(8);
    }

    public List<String> statusHistory() {
        return this.<List<String>>value("statusHistory").orElse(List.of());
    }
}
