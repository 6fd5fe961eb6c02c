package com.hivemind.dispatch.api;

import com.hivemind.core.engine.ObjectiveArena;
import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.error.ExecutionFailureException;
import com.hivemind.core.error.HivemindException;
import com.hivemind.core.error.ObjectiveNotFoundException;
import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.core.model.Task;
import com.hivemind.execution.WaveExecutor;
import com.hivemind.execution.WaveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for the objective lifecycle: intake, spawning, task reports, error
 * handling, waves, progress and cancellation.
 */
@RestController
@RequestMapping("/api/v1/objectives")
public class ObjectiveController {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveController.class);

    private final QueenCoordinator coordinator;
    private final WaveExecutor waveExecutor;
    private final SseStreamingService sseStreamingService;

    public ObjectiveController(QueenCoordinator coordinator, WaveExecutor waveExecutor,
                               SseStreamingService sseStreamingService) {
        this.coordinator = coordinator;
        this.waveExecutor = waveExecutor;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/objectives: Analyze an objective (and spawn agents when auto-spawn is on).
     */
    @PostMapping
    public ResponseEntity<?> submitObjective(@RequestBody ObjectiveRequest request) {
        if (request.description() == null || request.description().isBlank()) {
            return ApiErrors.badRequest("Objective description is required");
        }
        Priority priority;
        try {
            priority = request.priority() != null
                    ? Priority.valueOf(request.priority().toUpperCase(Locale.ROOT))
                    : Priority.MEDIUM;
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest("Invalid priority: " + request.priority());
        }

        var objective = new Objective(request.id(), request.description(), priority,
                request.constraints() != null ? new LinkedHashSet<>(request.constraints()) : null,
                request.metadata());
        try {
            String objectiveId = objective.id() != null && !objective.id().isBlank()
                    ? objective.id()
                    : coordinator.generateObjectiveId();
            coordinator.analyzeObjective(objective.withId(objectiveId));
            log.info("Accepted objective {}", objectiveId);
            return ResponseEntity.status(201).body(ObjectiveResponse.from(requireArena(objectiveId)));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping
    public List<Map<String, Object>> listObjectives() {
        return coordinator.listObjectives().stream()
                .map(arena -> {
                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("objectiveId", arena.id());
                    summary.put("description", arena.objective().description());
                    summary.put("status", arena.status().name());
                    summary.put("type", arena.analysis().type().tag());
                    summary.put("taskCount", arena.graph().effectiveTasks().size());
                    return summary;
                })
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getObjective(@PathVariable String id) {
        return coordinator.getArena(id)
                .<ResponseEntity<?>>map(arena -> ResponseEntity.ok(ObjectiveResponse.from(arena)))
                .orElseGet(() -> ApiErrors.toResponse(new ObjectiveNotFoundException(id)));
    }

    /**
     * POST /api/v1/objectives/{id}/agents: Plan and spawn missing agents.
     */
    @PostMapping("/{id}/agents")
    public ResponseEntity<?> spawnAgents(@PathVariable String id) {
        try {
            List<Agent> spawned = coordinator.spawnAgents(id);
            return ResponseEntity.ok(Map.of(
                    "spawned", spawned.stream().map(ObjectiveController::agentSummary).toList(),
                    "objective", ObjectiveResponse.from(requireArena(id))));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<?> getProgress(@PathVariable String id) {
        try {
            ProgressReport report = coordinator.monitorProgress(id);
            return ResponseEntity.ok(report);
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{id}/tasks/{taskId}/start")
    public ResponseEntity<?> startTask(@PathVariable String id, @PathVariable String taskId,
                                       @RequestBody(required = false) TaskReportRequest request) {
        try {
            Task task = coordinator.reportTaskStarted(id, taskId, request != null ? request.agentId() : null);
            return ResponseEntity.ok(task);
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{id}/tasks/{taskId}/complete")
    public ResponseEntity<?> completeTask(@PathVariable String id, @PathVariable String taskId) {
        try {
            return ResponseEntity.ok(coordinator.reportTaskCompleted(id, taskId));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{id}/tasks/{taskId}/fail")
    public ResponseEntity<?> failTask(@PathVariable String id, @PathVariable String taskId,
                                      @RequestBody(required = false) TaskReportRequest request) {
        String reason = request != null && request.reason() != null ? request.reason() : "Reported as failed";
        try {
            return ResponseEntity.ok(coordinator.reportTaskFailed(id, taskId, reason));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/v1/objectives/{id}/agents/{agentId}/blocked: Decide how to unblock an agent.
     */
    @PostMapping("/{id}/agents/{agentId}/blocked")
    public ResponseEntity<?> agentBlocked(@PathVariable String id, @PathVariable String agentId) {
        try {
            Decision decision = coordinator.handleAgentBlocked(id, agentId);
            return ResponseEntity.ok(decision);
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/v1/objectives/{id}/errors: Report an execution error for remediation.
     */
    @PostMapping("/{id}/errors")
    public ResponseEntity<?> reportError(@PathVariable String id, @RequestBody ExecutionErrorRequest request) {
        String message = request.message() != null ? request.message() : "Execution failed";
        RuntimeException error = request.isPermissionDenied()
                ? new PermissionDeniedException(request.operation(), request.resource(), message)
                : new ExecutionFailureException(message);
        var context = new ExecutionErrorContext(id, request.agentId(), request.taskId(),
                request.operation(), request.artifactType());
        try {
            boolean remediated = coordinator.handleExecutionError(error, context);
            return ResponseEntity.ok(Map.of(
                    "remediated", remediated,
                    "objective", ObjectiveResponse.from(requireArena(id))));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * POST /api/v1/objectives/{id}/waves: Execute up to {@code maxWaves} waves synchronously.
     */
    @PostMapping("/{id}/waves")
    public ResponseEntity<?> executeWaves(@PathVariable String id,
                                          @RequestParam(defaultValue = "1") int maxWaves) {
        if (maxWaves < 1) {
            return ApiErrors.badRequest("maxWaves must be at least 1");
        }
        try {
            List<WaveOutcome> outcomes = waveExecutor.runToCompletion(id, maxWaves);
            return ResponseEntity.ok(outcomes);
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{id}/reap")
    public ResponseEntity<?> reapStaleTasks(@PathVariable String id) {
        try {
            return ResponseEntity.ok(coordinator.reapStaleTasks(id));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancelObjective(@PathVariable String id) {
        try {
            List<Task> cancelled = coordinator.cancelObjective(id);
            return ResponseEntity.ok(Map.of(
                    "objectiveId", id,
                    "status", requireArena(id).status().name(),
                    "cancelledTasks", cancelled.size()));
        } catch (HivemindException e) {
            return ApiErrors.toResponse(e);
        }
    }

    /**
     * GET /api/v1/objectives/{id}/events: SSE stream of the objective's events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (coordinator.getArena(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private ObjectiveArena requireArena(String id) {
        return coordinator.getArena(id).orElseThrow(() -> new ObjectiveNotFoundException(id));
    }

    private static Map<String, Object> agentSummary(Agent agent) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", agent.id());
        summary.put("role", agent.role().tag());
        summary.put("status", agent.status().name());
        summary.put("specialist", agent.isSpecialist());
        return summary;
    }
}
