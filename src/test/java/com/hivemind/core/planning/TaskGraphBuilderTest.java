package com.hivemind.core.planning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.analysis.ObjectiveAnalyzer;
import com.hivemind.core.memory.InMemoryPatternStore;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.model.TaskType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphBuilderTest {

    private ObjectiveAnalyzer analyzer;
    private TaskGraphBuilder builder;

    @BeforeEach
    void setUp() {
        analyzer = new ObjectiveAnalyzer(new InMemoryPatternStore(new ObjectMapper().findAndRegisterModules(), 100, 5));
        builder = new TaskGraphBuilder();
    }

    private TaskGraph build(String description) {
        var objective = Objective.of("OBJ-2026-0001", description);
        return builder.build(objective, analyzer.analyze(objective));
    }

    private static Task firstMentioning(TaskGraph graph, String... keywords) {
        return graph.tasks().stream()
                .skip(1)
                .filter(t -> List.of(keywords).stream().anyMatch(t::mentions))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No task mentions " + List.of(keywords)));
    }

    @Test
    @DisplayName("widget graph runs styling and client work side by side after the structure task")
    void widgetGraphParallelSection() {
        TaskGraph graph = build("create a widget to show open incidents with a chart");

        assertTrue(graph.size() >= 6);
        Task structure = firstMentioning(graph, "template", "structure");
        Task styling = firstMentioning(graph, "style", "css");
        Task client = firstMentioning(graph, "client", "controller");

        assertEquals(Set.of(structure.id()), graph.dependenciesOf(styling.id()));
        assertEquals(Set.of(structure.id()), graph.dependenciesOf(client.id()));
        assertFalse(graph.dependenciesOf(styling.id()).contains(client.id()));
        assertFalse(graph.dependenciesOf(client.id()).contains(styling.id()));
    }

    @Test
    @DisplayName("the task after the parallel section joins every open branch")
    void joinTaskDependsOnBranches() {
        TaskGraph graph = build("create a widget to show open incidents with a chart");

        assertEquals(Set.of("OBJ-2026-0001-T03", "OBJ-2026-0001-T04", "OBJ-2026-0001-T05"),
                graph.dependenciesOf("OBJ-2026-0001-T06"));
        assertEquals(Set.of("OBJ-2026-0001-T06"), graph.dependenciesOf("OBJ-2026-0001-T07"));
    }

    @Test
    @DisplayName("approval workflow graph has an approval task")
    void approvalWorkflowGraph() {
        TaskGraph graph = build("build an approval workflow for change requests");
        assertTrue(graph.tasks().stream().anyMatch(t -> t.mentions("approval")));
    }

    @Test
    @DisplayName("unrecognised objective still yields a chained generic graph")
    void genericFallback() {
        TaskGraph graph = build("write a poem about the sea");

        assertEquals(8, graph.size());
        assertTrue(graph.tasks().get(0).content().endsWith("write a poem about the sea"));
        List<Task> tasks = graph.tasks();
        assertTrue(graph.dependenciesOf(tasks.get(0).id()).isEmpty());
        for (int i = 1; i < tasks.size(); i++) {
            assertEquals(Set.of(tasks.get(i - 1).id()), graph.dependenciesOf(tasks.get(i).id()));
        }
    }

    @Test
    @DisplayName("task ids are ordinal and zero padded")
    void taskIds() {
        assertEquals("OBJ-2026-0001-T01", TaskGraphBuilder.taskId("OBJ-2026-0001", 1));
        assertEquals("OBJ-2026-0001-T12", TaskGraphBuilder.taskId("OBJ-2026-0001", 12));
    }

    @ParameterizedTest
    @EnumSource(TaskType.class)
    @DisplayName("every template builds a valid pending graph")
    void everyTemplateBuilds(TaskType type) {
        var objective = Objective.of("OBJ-2026-0003", "objective text");
        var analysis = new TaskAnalysis(type, List.of(), 1, List.of(), null);

        TaskGraph graph = builder.build(objective, analysis);

        assertFalse(graph.tasks().isEmpty());
        assertTrue(graph.tasks().stream().allMatch(t -> t.status() == TaskStatus.PENDING));
        assertEquals(1, graph.readyFrontier().size());
    }
}
