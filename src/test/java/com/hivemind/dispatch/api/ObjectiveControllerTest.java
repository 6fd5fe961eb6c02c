package com.hivemind.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.engine.ObjectiveArena;
import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.error.ValidationException;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.model.TaskType;
import com.hivemind.core.planning.TaskGraph;
import com.hivemind.core.planning.TaskGraphBuilder;
import com.hivemind.execution.WaveExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ObjectiveController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ObjectiveControllerTest {

    private static final String ID = "OBJ-2026-0001";
    private static final String WIDGET = "create a widget to show open incidents with a chart";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private QueenCoordinator coordinator;

    @MockitoBean
    private WaveExecutor waveExecutor;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private ObjectiveArena arena(ObjectiveStatus status) {
        Objective objective = Objective.of(ID, WIDGET);
        TaskAnalysis analysis = new TaskAnalysis(TaskType.INTERACTIVE_COMPONENT,
                List.of(AgentRole.RESEARCHER, AgentRole.WIDGET_CREATOR), 5, List.of(), null);
        TaskGraph graph = new TaskGraphBuilder().build(objective, analysis);

        ObjectiveArena arena = mock(ObjectiveArena.class);
        when(arena.id()).thenReturn(ID);
        when(arena.objective()).thenReturn(objective);
        when(arena.analysis()).thenReturn(analysis);
        when(arena.graph()).thenReturn(graph);
        when(arena.status()).thenReturn(status);
        when(arena.history()).thenReturn(List.of(ObjectiveStatus.SUBMITTED, ObjectiveStatus.ANALYZED,
                ObjectiveStatus.GRAPH_BUILT));
        return arena;
    }

    // -- POST /api/v1/objectives --

    @Nested
    @DisplayName("POST /objectives")
    class Submit {

        @Test
        @DisplayName("returns 201 with the analyzed objective")
        void submitObjective() throws Exception {
            ObjectiveArena arena = arena(ObjectiveStatus.GRAPH_BUILT);
            when(coordinator.generateObjectiveId()).thenReturn(ID);
            when(coordinator.getArena(ID)).thenReturn(Optional.of(arena));

            String body = objectMapper.writeValueAsString(
                    new ObjectiveRequest(null, WIDGET, "high", List.of("tester"), null));

            mockMvc.perform(post("/api/v1/objectives")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.objectiveId").value(ID))
                    .andExpect(jsonPath("$.type").value("interactive-component"))
                    .andExpect(jsonPath("$.tasks", hasSize(8)))
                    .andExpect(jsonPath("$.tasks[0].id").value(ID + "-T01"));

            ArgumentCaptor<Objective> captor = ArgumentCaptor.forClass(Objective.class);
            verify(coordinator).analyzeObjective(captor.capture());
            assertEquals(ID, captor.getValue().id());
            assertTrue(captor.getValue().constraints().contains("tester"));
        }

        @Test
        @DisplayName("blank description returns 400")
        void blankDescription() throws Exception {
            mockMvc.perform(post("/api/v1/objectives")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"  \"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("ValidationException"));

            verify(coordinator, never()).analyzeObjective(any());
        }

        @Test
        @DisplayName("unknown priority returns 400")
        void invalidPriority() throws Exception {
            mockMvc.perform(post("/api/v1/objectives")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"description\":\"write a script\",\"priority\":\"URGENT\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Invalid priority: URGENT"));
        }

        @Test
        @DisplayName("duplicate id returns 400")
        void duplicateId() throws Exception {
            when(coordinator.analyzeObjective(any()))
                    .thenThrow(new ValidationException("Objective " + ID + " already exists"));

            mockMvc.perform(post("/api/v1/objectives")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"id\":\"" + ID + "\",\"description\":\"write a script\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Objective " + ID + " already exists"));
        }
    }

    // -- GET /api/v1/objectives --

    @Test
    @DisplayName("GET /objectives lists summaries")
    void listObjectives() throws Exception {
        ObjectiveArena arena = arena(ObjectiveStatus.MONITORING);
        when(coordinator.listObjectives()).thenReturn(List.of(arena));

        mockMvc.perform(get("/api/v1/objectives"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status").value("MONITORING"))
                .andExpect(jsonPath("$[0].taskCount").value(8));
    }

    @Test
    @DisplayName("GET /objectives/{id} for an unknown id returns 404")
    void unknownObjective() throws Exception {
        when(coordinator.getArena("OBJ-missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/objectives/OBJ-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ObjectiveNotFoundException"));
    }

    @Test
    @DisplayName("GET /objectives/{id}/progress returns the report")
    void progress() throws Exception {
        when(coordinator.monitorProgress(ID)).thenReturn(new ProgressReport(ID, 37.5,
                Map.of(ID + "-researcher-01", 100.0), List.of("Task " + ID + "-T05 has failed"), null));

        mockMvc.perform(get("/api/v1/objectives/" + ID + "/progress"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overallProgress").value(37.5))
                .andExpect(jsonPath("$.blockingIssues", hasSize(1)));
    }

    // -- task reports --

    @Nested
    @DisplayName("task reports")
    class TaskReports {

        @Test
        @DisplayName("start passes the agent id")
        void start() throws Exception {
            String taskId = ID + "-T01";
            Task started = Task.pending(taskId, "Research", Priority.HIGH)
                    .start(Instant.parse("2026-03-01T10:00:00Z"));
            when(coordinator.reportTaskStarted(ID, taskId, "agent-1")).thenReturn(started);

            mockMvc.perform(post("/api/v1/objectives/" + ID + "/tasks/" + taskId + "/start")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"agentId\":\"agent-1\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
        }

        @Test
        @DisplayName("completing before dependencies returns 409")
        void completeTooEarly() throws Exception {
            when(coordinator.reportTaskCompleted(anyString(), anyString()))
                    .thenThrow(new InvalidTransitionException("Task has incomplete dependencies"));

            mockMvc.perform(post("/api/v1/objectives/" + ID + "/tasks/" + ID + "-T02/complete"))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("fail without a body uses the default reason")
        void failDefaultReason() throws Exception {
            String taskId = ID + "-T01";
            when(coordinator.reportTaskFailed(ID, taskId, "Reported as failed"))
                    .thenReturn(Task.pending(taskId, "Research", Priority.HIGH));

            mockMvc.perform(post("/api/v1/objectives/" + ID + "/tasks/" + taskId + "/fail"))
                    .andExpect(status().isOk());

            verify(coordinator).reportTaskFailed(ID, taskId, "Reported as failed");
        }
    }

    // -- errors, waves, cancellation --

    @Test
    @DisplayName("POST /errors maps permission_denied to a permission failure")
    void reportPermissionError() throws Exception {
        ObjectiveArena arena = arena(ObjectiveStatus.MONITORING);
        when(coordinator.handleExecutionError(any(), any())).thenReturn(true);
        when(coordinator.getArena(ID)).thenReturn(Optional.of(arena));

        String body = objectMapper.writeValueAsString(new ExecutionErrorRequest("permission_denied",
                ID + "-T01", "agent-1", "create", "sp_widget", "403 Forbidden", "widget"));

        mockMvc.perform(post("/api/v1/objectives/" + ID + "/errors")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remediated").value(true));

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        ArgumentCaptor<ExecutionErrorContext> context = ArgumentCaptor.forClass(ExecutionErrorContext.class);
        verify(coordinator).handleExecutionError(error.capture(), context.capture());
        var denied = assertInstanceOf(PermissionDeniedException.class, error.getValue());
        assertEquals("create:sp_widget", denied.remediationKey());
        assertEquals(ID + "-T01", context.getValue().taskId());
    }

    @Test
    @DisplayName("POST /waves with maxWaves below 1 returns 400")
    void invalidWaveCount() throws Exception {
        mockMvc.perform(post("/api/v1/objectives/" + ID + "/waves").param("maxWaves", "0"))
                .andExpect(status().isBadRequest());

        verify(waveExecutor, never()).runToCompletion(anyString(), anyInt());
    }

    @Test
    @DisplayName("POST /cancel reports the cancelled task count")
    void cancel() throws Exception {
        ObjectiveArena arena = arena(ObjectiveStatus.CANCELLED);
        when(coordinator.getArena(ID)).thenReturn(Optional.of(arena));
        List<Task> tasks = arena.graph().tasks();
        when(coordinator.cancelObjective(ID)).thenReturn(tasks);

        mockMvc.perform(post("/api/v1/objectives/" + ID + "/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.cancelledTasks").value(8));
    }

    @Test
    @DisplayName("GET /events for an unknown objective returns 404")
    void eventsUnknown() throws Exception {
        when(coordinator.getArena("OBJ-missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/objectives/OBJ-missing/events"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(sseStreamingService);
    }
}
