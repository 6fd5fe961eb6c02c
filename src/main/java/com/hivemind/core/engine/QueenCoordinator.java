package com.hivemind.core.engine;

import com.hivemind.core.assignment.CapabilityMatcher;
import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.decision.DecisionEngine;
import com.hivemind.core.error.CoordinationException;
import com.hivemind.core.error.HivemindException;
import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.ObjectiveNotFoundException;
import com.hivemind.core.error.PermissionDeniedException;
import com.hivemind.core.error.ValidationException;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.graph.IntakeGraph;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.memory.PatternStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentProfile;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.CoordinatorStatus;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.DecisionRequest;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.ExecutionPlan;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.ObjectiveStatus;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.model.TaskHistoryEntry;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.monitor.ProgressMonitor;
import com.hivemind.core.planning.TaskGraph;
import com.hivemind.core.remediation.PermissionRemediator;
import com.hivemind.core.remediation.RemediationPlan;
import com.hivemind.core.scheduler.ParallelizationPlanner;
import com.hivemind.core.state.IntakeState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The Queen: owns every objective arena and drives it through analysis, agent spawning,
 * task assignment, progress monitoring, error handling and cancellation.
 * <p>
 * All public operations are serialized on the coordinator, so callers (REST, CLI, the wave
 * executor and the stale-task sweeper) never observe a half-applied state change. Arenas
 * never share tasks or agents.
 */
@Service
public class QueenCoordinator {

    private static final Logger log = LoggerFactory.getLogger(QueenCoordinator.class);

    static final String SPAWN_HELPER = "spawn_helper_agent";
    static final String REASSIGN_TASK = "reassign_task";
    static final String PROVIDE_FALLBACK = "provide_fallback";
    static final String WAIT_FOR_DEPENDENCY = "wait_for_dependency";
    static final List<String> BLOCKED_AGENT_OPTIONS =
            List.of(SPAWN_HELPER, REASSIGN_TASK, PROVIDE_FALLBACK, WAIT_FOR_DEPENDENCY);

    private final IntakeGraph intakeGraph;
    private final ParallelizationPlanner planner;
    private final CapabilityMatcher capabilityMatcher;
    private final ProgressMonitor progressMonitor;
    private final DecisionEngine decisionEngine;
    private final PermissionRemediator remediator;
    private final PatternStore patternStore;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final HivemindProperties properties;
    private final Clock clock;

    private final Map<String, ObjectiveArena> arenas = new LinkedHashMap<>();
    private final AtomicInteger objectiveCounter = new AtomicInteger(0);
    private final AtomicInteger errorCounter = new AtomicInteger(0);

    @Autowired
    public QueenCoordinator(IntakeGraph intakeGraph, ParallelizationPlanner planner,
                            CapabilityMatcher capabilityMatcher, ProgressMonitor progressMonitor,
                            DecisionEngine decisionEngine, PermissionRemediator remediator,
                            PatternStore patternStore, EventBus eventBus, HivemindMetrics metrics,
                            HivemindProperties properties) {
        this(intakeGraph, planner, capabilityMatcher, progressMonitor, decisionEngine, remediator,
                patternStore, eventBus, metrics, properties, Clock.systemUTC());
    }

    QueenCoordinator(IntakeGraph intakeGraph, ParallelizationPlanner planner,
                     CapabilityMatcher capabilityMatcher, ProgressMonitor progressMonitor,
                     DecisionEngine decisionEngine, PermissionRemediator remediator,
                     PatternStore patternStore, EventBus eventBus, HivemindMetrics metrics,
                     HivemindProperties properties, Clock clock) {
        this.intakeGraph = intakeGraph;
        this.planner = planner;
        this.capabilityMatcher = capabilityMatcher;
        this.progressMonitor = progressMonitor;
        this.decisionEngine = decisionEngine;
        this.remediator = remediator;
        this.patternStore = patternStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    // -- Intake --

    /**
     * Classifies the objective, builds its task graph and, when auto-spawn is enabled,
     * spawns and assigns agents right away.
     *
     * @return the analysis; the arena is available through {@link #getArena(String)}
     * @throws ValidationException when the description is blank or the id is already taken
     */
    public synchronized TaskAnalysis analyzeObjective(Objective objective) {
        if (objective == null || objective.description() == null || objective.description().isBlank()) {
            String id = objective != null ? objective.id() : null;
            publish(id, "objective.error", Map.of("error", "Objective description must not be blank"));
            throw new ValidationException("Objective description must not be blank");
        }
        Objective submitted = objective.id() == null || objective.id().isBlank()
                ? objective.withId(generateObjectiveId())
                : objective;
        String objectiveId = submitted.id();
        if (arenas.containsKey(objectiveId)) {
            throw new ValidationException("Objective " + objectiveId + " already exists");
        }

        MdcContext.setObjective(objectiveId);
        long startMs = clock.millis();
        try {
            log.info("Analyzing objective {}: {}", objectiveId, submitted.description());
            publish(objectiveId, "objective.analyzing", Map.of("description", submitted.description()));

            IntakeState state = intakeGraph.run(submitted, properties.isAutoSpawn(), properties.getMaxConcurrentAgents());
            TaskAnalysis analysis = state.analysis().orElseThrow(() ->
                    new CoordinationException("Intake produced no analysis for objective " + objectiveId));
            TaskGraph graph = state.taskGraph().orElseThrow(() ->
                    new CoordinationException("Intake produced no task graph for objective " + objectiveId));
            List<ObjectiveStatus> intakeHistory = state.statusHistory().stream()
                    .map(ObjectiveStatus::valueOf)
                    .toList();

            ObjectiveArena arena = new ObjectiveArena(submitted, analysis, graph, intakeHistory, clock.instant());
            arenas.put(objectiveId, arena);

            var snapshot = new LinkedHashMap<String, Object>();
            snapshot.put("objective", submitted);
            snapshot.put("analysis", analysis);
            snapshot.put("tasks", graph.tasks());
            snapshot.put("timestamp", clock.instant().toString());
            patternStore.store("analysis_" + objectiveId, snapshot);

            metrics.recordAnalysisDuration(analysis.type().tag(), clock.millis() - startMs);
            publish(objectiveId, "objective.analyzed", Map.of(
                    "type", analysis.type().tag(),
                    "complexity", analysis.estimatedComplexity(),
                    "taskCount", graph.size(),
                    "requiredCapabilities", analysis.requiredCapabilities().stream().map(AgentRole::tag).toList()));
            log.info("Objective {} analyzed as {} with {} tasks", objectiveId, analysis.type().tag(), graph.size());

            if (state.status() == ObjectiveStatus.SPAWNING) {
                spawnAgents(objectiveId, state.executionPlan().orElse(null));
            }
            return analysis;
        } catch (RuntimeException e) {
            HivemindException known = HivemindException.find(e);
            publish(objectiveId, "objective.error", Map.of("error", String.valueOf(e.getMessage())));
            if (known != null && !(known instanceof CoordinationException)) {
                throw known;
            }
            throw coordinationFailure("analyzeObjective", objectiveId, known != null ? known : e);
        } finally {
            MdcContext.clear();
        }
    }

    // -- Spawning --

    /**
     * Plans execution, spawns the missing agents within the concurrency cap and assigns
     * pending tasks. Calling it again on an objective that already has agents only tops up
     * roles that are not live.
     *
     * @return the agents spawned by this call
     */
    public synchronized List<Agent> spawnAgents(String objectiveId) {
        return spawnAgents(objectiveId, null);
    }

    /** Spawns against {@code intakePlan} when intake already planned this graph, replanning otherwise. */
    private List<Agent> spawnAgents(String objectiveId, ExecutionPlan intakePlan) {
        ObjectiveArena arena = requireArena(objectiveId);
        if (arena.isCancelled() || arena.status().isTerminal()) {
            throw new InvalidTransitionException(objectiveId, arena.status(), ObjectiveStatus.SPAWNING);
        }
        MdcContext.setObjective(objectiveId);
        try {
            arena.transition(ObjectiveStatus.SPAWNING);
            int cap = properties.getMaxConcurrentAgents();
            ExecutionPlan plan = intakePlan != null && arena.liveAgents().isEmpty()
                    ? intakePlan
                    : planner.plan(arena.graph(), arena.analysis(), arena.liveAgents(), cap);
            arena.recordPlan(plan);
            metrics.recordPlan(plan.strategy().name(), plan.waves().size());

            Set<AgentRole> roster = Set.copyOf(arena.analysis().requiredCapabilities());
            var spawned = new ArrayList<Agent>();
            for (AgentRole role : plan.rolesToSpawn()) {
                if (arena.liveAgents().size() >= cap) {
                    log.info("Concurrency cap {} reached, not spawning {}", cap, role.tag());
                    break;
                }
                AgentProfile profile = roster.contains(role)
                        ? new AgentProfile.Core(role)
                        : new AgentProfile.Specialist(role, specialization(role, arena.analysis()));
                spawned.add(spawn(arena, profile));
            }

            Map<String, String> assigned = capabilityMatcher.assign(arena.graph(), arena.liveAgents(), plan);
            refreshAgentStatuses(arena);
            long unassigned = arena.graph().effectiveTasks().stream()
                    .filter(t -> t.status() == TaskStatus.PENDING)
                    .filter(t -> arena.graph().assigneeOf(t.id()).isEmpty())
                    .count();
            publish(objectiveId, "todos.assigned", Map.of(
                    "assigned", assigned.size(),
                    "unassigned", unassigned,
                    "strategy", plan.strategy().name()));

            patternStore.store("agents_" + objectiveId, arena.agents());
            arena.transition(ObjectiveStatus.MONITORING);
            log.info("Objective {} now has {} live agents ({} new), {} tasks assigned",
                    objectiveId, arena.liveAgents().size(), spawned.size(), assigned.size());
            return spawned;
        } finally {
            MdcContext.clear();
        }
    }

    private Agent spawn(ObjectiveArena arena, AgentProfile profile) {
        AgentRole role = profile.role();
        String agentId = "%s-%s-%02d".formatted(arena.id(), role.tag(), arena.agents().size() + 1);
        Agent agent = new Agent(agentId, arena.id(), AgentStatus.IDLE, clock.instant(), profile);
        arena.putAgent(agent);
        metrics.recordAgentSpawned(role.tag(), agent.isSpecialist());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("agentId", agentId);
        payload.put("role", role.tag());
        payload.put("kind", agent.isSpecialist() ? "specialist" : "core");
        payload.put("capabilities", agent.capabilities());
        if (profile instanceof AgentProfile.Specialist specialist) {
            payload.put("specialization", specialist.specialization());
        }
        publish(arena.id(), "agent.spawned", payload);
        log.info("Spawned {} agent {}", payload.get("kind"), agentId);
        return agent;
    }

    private static String specialization(AgentRole role, TaskAnalysis analysis) {
        return role.capabilities().get(0) + " for " + analysis.type().tag();
    }

    // -- Task lifecycle --

    public synchronized Task reportTaskStarted(String objectiveId, String taskId, String agentId) {
        ObjectiveArena arena = requireActiveArena(objectiveId);
        if (agentId != null) {
            Agent agent = arena.agent(agentId).orElseThrow(() ->
                    new ValidationException("Unknown agent " + agentId + " in objective " + objectiveId));
            if (!agent.status().isLive()) {
                throw new InvalidTransitionException("Agent " + agentId + " is " + agent.status() + " and cannot start work");
            }
            if (arena.graph().isManual(taskId)) {
                throw new InvalidTransitionException("Task " + taskId + " is a manual action and cannot be started by an agent");
            }
        }
        Task started = arena.graph().start(taskId, clock.instant());
        if (agentId != null && arena.graph().assigneeOf(taskId).isEmpty()) {
            arena.graph().assign(taskId, agentId);
        }
        refreshAgentStatuses(arena);
        publishTaskUpdate(arena, started);
        return started;
    }

    /**
     * Marks a task completed. Completing the last effective task completes the objective and
     * records the outcome for learning. Manual-action tasks are never started by an agent,
     * so an operator may complete them straight from PENDING.
     *
     * @throws InvalidTransitionException when the task is not in progress or a dependency is incomplete
     */
    public synchronized Task reportTaskCompleted(String objectiveId, String taskId) {
        ObjectiveArena arena = requireActiveArena(objectiveId);
        TaskGraph graph = arena.graph();
        Instant now = clock.instant();
        if (graph.isManual(taskId) && graph.task(taskId).status() == TaskStatus.PENDING) {
            graph.start(taskId, now);
            log.info("Manual action {} completed by operator", taskId);
        }
        Task completed = graph.complete(taskId, now);
        metrics.recordTaskOutcome("completed");
        refreshAgentStatuses(arena);
        publishTaskUpdate(arena, completed);
        if (arena.graph().allCompleted()) {
            completeObjective(arena);
        }
        return completed;
    }

    public synchronized Task reportTaskFailed(String objectiveId, String taskId, String reason) {
        ObjectiveArena arena = requireActiveArena(objectiveId);
        Task failed = arena.graph().fail(taskId, clock.instant(), reason);
        metrics.recordTaskOutcome("failed");
        refreshAgentStatuses(arena);
        publishTaskUpdate(arena, failed);
        return failed;
    }

    /**
     * Ready tasks with a live, unblocked assignee, in queue order. Used by the wave executor
     * to decide what to run next; does not change any state except the wave counter.
     */
    public synchronized List<DispatchTicket> nextWave(String objectiveId, int limit) {
        ObjectiveArena arena = requireActiveArena(objectiveId);
        List<Task> ready = dispatchable(arena);
        if (ready.isEmpty()) {
            return List.of();
        }
        int wave = arena.nextWaveNumber();
        var tickets = new ArrayList<DispatchTicket>();
        for (Task task : ready) {
            if (tickets.size() >= limit) {
                break;
            }
            String agentId = arena.graph().assigneeOf(task.id()).orElseThrow();
            tickets.add(new DispatchTicket(objectiveId, wave, task, arena.agent(agentId).orElseThrow()));
        }
        return tickets;
    }

    private List<Task> dispatchable(ObjectiveArena arena) {
        TaskGraph graph = arena.graph();
        return graph.readyFrontier().stream()
                .filter(t -> !graph.isManual(t.id()))
                .filter(t -> graph.assigneeOf(t.id())
                        .flatMap(arena::agent)
                        .map(a -> a.status() == AgentStatus.IDLE || a.status() == AgentStatus.ACTIVE)
                        .orElse(false))
                .toList();
    }

    // -- Monitoring --

    /**
     * Computes the progress report, stores it and updates the objective lifecycle
     * (completion or stall detection). Repeated calls without state changes return the
     * same percentages and issues.
     */
    public synchronized ProgressReport monitorProgress(String objectiveId) {
        ObjectiveArena arena = requireArena(objectiveId);
        MdcContext.setObjective(objectiveId);
        try {
            ProgressReport report = progressMonitor.report(arena.graph(), arena.agents(), arena.createdAt(), clock.instant());
            patternStore.store("progress_" + objectiveId, report);
            publish(objectiveId, "progress.updated", Map.of(
                    "overallProgress", report.overallProgress(),
                    "blockingIssues", report.blockingIssues().size()));
            updateLifecycle(arena, report);
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private void updateLifecycle(ObjectiveArena arena, ProgressReport report) {
        if (arena.status().isTerminal()) {
            return;
        }
        if (arena.graph().allCompleted()) {
            completeObjective(arena);
            return;
        }
        boolean stalled = !report.blockingIssues().isEmpty()
                && arena.graph().countByStatus(TaskStatus.IN_PROGRESS) == 0
                && dispatchable(arena).isEmpty();
        if (stalled && arena.status() == ObjectiveStatus.MONITORING) {
            arena.transition(ObjectiveStatus.STALLED);
            log.warn("Objective {} stalled with {} blocking issues", arena.id(), report.blockingIssues().size());
            publish(arena.id(), "objective.stalled", Map.of("blockingIssues", report.blockingIssues()));
        } else if (!stalled && arena.status() == ObjectiveStatus.STALLED) {
            arena.transition(ObjectiveStatus.MONITORING);
        }
    }

    /**
     * Fails in-progress tasks that exceeded the stale threshold plus grace period and queues
     * a retry for each so downstream work can continue.
     *
     * @return the tasks that were failed
     */
    public synchronized List<Task> reapStaleTasks(String objectiveId) {
        ObjectiveArena arena = requireArena(objectiveId);
        if (arena.status().isTerminal()) {
            return List.of();
        }
        Instant now = clock.instant();
        TaskGraph graph = arena.graph();
        var reaped = new ArrayList<Task>();
        for (Task stale : progressMonitor.findReapableTasks(graph, now)) {
            long minutes = Duration.between(stale.startedAt(), now).toMinutes();
            Task failed = graph.fail(stale.id(), now, "No completion reported after " + minutes + " minutes");
            graph.unassign(stale.id());

            String retryId = "%s-S%02d".formatted(arena.id(), countWithPrefix(graph, arena.id() + "-S") + 1);
            graph.prepend(List.of(Task.pending(retryId, "Retry stalled task: " + stale.content(), stale.priority())),
                    Map.of(retryId, Set.copyOf(graph.dependenciesOf(stale.id()))));
            graph.supersede(stale.id(), retryId);
            if (graph.isManual(stale.id())) {
                graph.markManual(List.of(retryId));
            }

            metrics.incrementStaleTasks();
            publishTaskUpdate(arena, failed);
            log.warn("Reaped stale task {} after {} minutes, retry queued as {}", stale.id(), minutes, retryId);
            reaped.add(failed);
        }
        if (!reaped.isEmpty()) {
            capabilityMatcher.assign(graph, arena.liveAgents(), null);
            refreshAgentStatuses(arena);
        }
        return reaped;
    }

    /** Reaps stale tasks across every non-terminal objective. */
    public synchronized int reapAllStaleTasks() {
        int total = 0;
        for (String objectiveId : List.copyOf(arenas.keySet())) {
            total += reapStaleTasks(objectiveId).size();
        }
        return total;
    }

    private static int countWithPrefix(TaskGraph graph, String prefix) {
        return (int) graph.tasks().stream().filter(t -> t.id().startsWith(prefix)).count();
    }

    // -- Error handling --

    /**
     * Handles an error raised while executing a task. Permission failures are remediated by
     * queuing a retry (and manual actions when the same failure repeats); other errors fail
     * the task.
     *
     * @return {@code true} when the error was remediated automatically and execution may continue
     */
    public synchronized boolean handleExecutionError(Throwable error, ExecutionErrorContext context) {
        if (error == null || context == null) {
            throw new ValidationException("Both the error and its context are required");
        }
        ObjectiveArena arena = requireArena(context.objectiveId());
        if (arena.status().isTerminal()) {
            log.info("Ignoring execution error for terminal objective {}: {}", arena.id(), error.getMessage());
            return false;
        }
        if (context.taskId() != null) {
            requireFailable(arena.graph(), context.taskId());
        }
        MdcContext.setTask(arena.id(), context.taskId(), null);
        try {
            HivemindException known = HivemindException.find(error);
            if (known instanceof PermissionDeniedException permissionDenied) {
                return remediatePermission(arena, permissionDenied, context);
            }

            String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            log.error("Execution error in objective {} task {}: {}", arena.id(), context.taskId(), reason, error);
            if (context.taskId() != null) {
                failTask(arena, context.taskId(), reason).ifPresent(t -> publishTaskUpdate(arena, t));
            }
            recordError("execution", arena.id(), error);
            refreshAgentStatuses(arena);
            publish(arena.id(), "coordination.execution_failed", Map.of(
                    "operation", String.valueOf(context.operation()),
                    "error", reason));
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private boolean remediatePermission(ObjectiveArena arena, PermissionDeniedException error,
                                        ExecutionErrorContext context) {
        TaskGraph graph = arena.graph();
        boolean repeated = arena.wasRemediated(error.remediationKey());
        RemediationPlan plan = remediator.plan(error, context, graph, repeated);

        String previousAssignee = null;
        Optional<Task> failed = Optional.empty();
        if (context.taskId() != null) {
            previousAssignee = graph.assigneeOf(context.taskId()).orElse(context.agentId());
            failed = failTask(arena, context.taskId(), "Permission denied: " + error.getMessage());
        }
        graph.prepend(plan.tasks(), plan.dependencies());
        graph.markManual(plan.manualTaskIds());
        if (context.taskId() != null
                && graph.task(context.taskId()).status() == TaskStatus.FAILED && !graph.isSuperseded(context.taskId())) {
            graph.supersede(context.taskId(), plan.retryTaskId());
        }
        failed.ifPresent(t -> publishTaskUpdate(arena, t));
        if (previousAssignee != null && arena.agent(previousAssignee).map(a -> a.status().isLive()).orElse(false)) {
            graph.assign(plan.retryTaskId(), previousAssignee);
        }
        capabilityMatcher.assign(graph, arena.liveAgents(), null);
        refreshAgentStatuses(arena);
        metrics.recordRemediation(plan.automatic());

        var payload = new LinkedHashMap<String, Object>();
        payload.put("operation", String.valueOf(error.getOperation()));
        payload.put("resource", String.valueOf(error.getResource()));
        payload.put("retryTaskId", plan.retryTaskId());
        if (plan.automatic()) {
            arena.markRemediated(error.remediationKey());
            publish(arena.id(), "coordination.remediation_applied", payload);
            log.info("Permission failure on {} remediated automatically", error.remediationKey());
            return true;
        }
        payload.put("manualActions", plan.manualActions());
        publish(arena.id(), "coordination.manual_intervention_required", payload);
        log.warn("Permission failure on {} needs manual intervention: {}", error.remediationKey(), plan.manualActions());
        return false;
    }

    /** Rejects error reports for unknown tasks or for pending tasks that could not have started. */
    private static void requireFailable(TaskGraph graph, String taskId) {
        Task task = graph.task(taskId);
        if (task.status() == TaskStatus.PENDING && !graph.dependenciesComplete(taskId)) {
            throw new InvalidTransitionException("Task " + taskId + " cannot fail before its dependencies complete");
        }
    }

    /** Fails a pending or in-progress task, routing pending ones through IN_PROGRESS first. */
    private Optional<Task> failTask(ObjectiveArena arena, String taskId, String reason) {
        TaskGraph graph = arena.graph();
        Task current = graph.task(taskId);
        Instant now = clock.instant();
        if (current.status() == TaskStatus.PENDING) {
            graph.start(taskId, now);
        } else if (current.status() != TaskStatus.IN_PROGRESS) {
            log.debug("Task {} already {}, not failing it again", taskId, current.status());
            return Optional.empty();
        }
        metrics.recordTaskOutcome("failed");
        return Optional.of(graph.fail(taskId, now, reason));
    }

    /**
     * Records a coordination failure under {@code error_<timestamp>} and rethrows it.
     */
    public synchronized void handleCoordinationError(Throwable error, String operation) {
        throw coordinationFailure(operation, null, error);
    }

    private CoordinationException coordinationFailure(String operation, String objectiveId, Throwable error) {
        recordError(operation, objectiveId, error);
        publish(objectiveId, "coordination.error", Map.of(
                "operation", operation,
                "error", String.valueOf(error.getMessage())));
        log.error("Coordination failure during {}: {}", operation, error.getMessage(), error);
        if (error instanceof CoordinationException coordination) {
            return coordination;
        }
        return new CoordinationException("Coordination failed during " + operation + ": " + error.getMessage(), error);
    }

    private void recordError(String operation, String objectiveId, Throwable error) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("operation", operation);
        if (objectiveId != null) {
            entry.put("objectiveId", objectiveId);
        }
        entry.put("type", error.getClass().getSimpleName());
        entry.put("message", String.valueOf(error.getMessage()));
        entry.put("timestamp", clock.instant().toString());
        try {
            patternStore.store("error_%d_%d".formatted(clock.millis(), errorCounter.incrementAndGet()), entry);
        } catch (HivemindException storeFailure) {
            log.warn("Could not record {} error in pattern store: {}", operation, storeFailure.getMessage());
            error.addSuppressed(storeFailure);
        }
    }

    // -- Decisions --

    /**
     * Picks a recovery option for a blocked agent and applies it. Options that already
     * failed for the same agent are penalized.
     */
    public synchronized Decision handleAgentBlocked(String objectiveId, String agentId) {
        ObjectiveArena arena = requireActiveArena(objectiveId);
        Agent agent = arena.agent(agentId).orElseThrow(() ->
                new ValidationException("Unknown agent " + agentId + " in objective " + objectiveId));
        arena.updateAgentStatus(agentId, AgentStatus.BLOCKED);
        publish(objectiveId, "agent.blocked", Map.of("agentId", agentId, "role", agent.role().tag()));

        var state = new HashMap<String, Object>();
        state.put("agentId", agentId);
        state.put("role", agent.role().tag());
        state.put("pendingTasks", graphTaskIds(arena, agentId));
        state.put("failedAttempts", arena.attemptsFor(agentId));
        Decision decision = makeDecision(new DecisionRequest(objectiveId,
                arena.objective().description(), state, BLOCKED_AGENT_OPTIONS));
        arena.recordAttempt(agentId, decision.chosenOption());

        applyBlockedDecision(arena, agent, decision.chosenOption());
        return decision;
    }

    private void applyBlockedDecision(ObjectiveArena arena, Agent blocked, String option) {
        switch (option) {
            case SPAWN_HELPER -> {
                if (arena.liveAgents().size() >= properties.getMaxConcurrentAgents()) {
                    log.info("No capacity for a helper in {}, reassigning instead", arena.id());
                    reassignFrom(arena, blocked, null);
                    return;
                }
                if (arena.status() == ObjectiveStatus.MONITORING || arena.status() == ObjectiveStatus.STALLED) {
                    arena.transition(ObjectiveStatus.SPAWNING);
                }
                Agent helper = spawn(arena, new AgentProfile.Specialist(blocked.role(),
                        "helper for " + blocked.id()));
                reassignFrom(arena, blocked, helper);
                if (arena.status() == ObjectiveStatus.SPAWNING) {
                    arena.transition(ObjectiveStatus.MONITORING);
                }
            }
            case REASSIGN_TASK -> reassignFrom(arena, blocked, null);
            default -> log.info("Agent {} keeps its tasks ({})", blocked.id(), option);
        }
    }

    private void reassignFrom(ObjectiveArena arena, Agent blocked, Agent target) {
        TaskGraph graph = arena.graph();
        for (Task task : graph.tasksAssignedTo(blocked.id())) {
            if (task.status() != TaskStatus.PENDING) {
                continue;
            }
            graph.unassign(task.id());
            if (target != null) {
                graph.assign(task.id(), target.id());
            }
        }
        capabilityMatcher.assign(graph, arena.liveAgents(), arena.lastPlan().orElse(null));
        refreshAgentStatuses(arena);
    }

    private static List<String> graphTaskIds(ObjectiveArena arena, String agentId) {
        return arena.graph().tasksAssignedTo(agentId).stream()
                .filter(t -> !t.status().isTerminal())
                .map(Task::id)
                .toList();
    }

    public synchronized Decision makeDecision(DecisionRequest request) {
        Decision decision = decisionEngine.decide(request);
        metrics.recordDecision(decision.confidence());
        publish(request.objectiveId(), "decision.made", Map.of(
                "chosenOption", decision.chosenOption(),
                "confidence", decision.confidence(),
                "reasoning", decision.reasoning()));
        return decision;
    }

    // -- Cancellation and shutdown --

    /**
     * Cancels every non-terminal task and stops the objective's agents from taking new
     * work. Cancelling an already cancelled objective is a no-op.
     *
     * @throws InvalidTransitionException when the objective already completed
     */
    public synchronized List<Task> cancelObjective(String objectiveId) {
        ObjectiveArena arena = requireArena(objectiveId);
        if (arena.isCancelled()) {
            return List.of();
        }
        if (arena.status().isTerminal()) {
            throw new InvalidTransitionException(objectiveId, arena.status(), ObjectiveStatus.CANCELLED);
        }
        List<Task> cancelled = arena.graph().cancelAll(clock.instant());
        arena.liveAgents().forEach(a -> arena.updateAgentStatus(a.id(), AgentStatus.COMPLETED));
        arena.transition(ObjectiveStatus.CANCELLED);
        metrics.recordObjectiveResult(ObjectiveStatus.CANCELLED.name());
        publish(objectiveId, "objective.cancelled", Map.of("cancelledTasks", cancelled.size()));
        log.info("Objective {} cancelled, {} tasks cancelled", objectiveId, cancelled.size());
        return cancelled;
    }

    @PreDestroy
    public synchronized void shutdown() {
        int objectives = arenas.size();
        for (ObjectiveArena arena : arenas.values()) {
            arena.liveAgents().forEach(a -> arena.updateAgentStatus(a.id(), AgentStatus.COMPLETED));
        }
        arenas.clear();
        publish(null, "coordinator.shutdown", Map.of("objectives", objectives));
        log.info("Coordinator shut down, released {} objectives", objectives);
    }

    // -- Queries --

    public synchronized CoordinatorStatus getStatus() {
        int activeObjectives = 0;
        int activeAgents = 0;
        int totalTasks = 0;
        int completedTasks = 0;
        for (ObjectiveArena arena : arenas.values()) {
            if (!arena.status().isTerminal()) {
                activeObjectives++;
            }
            activeAgents += (int) arena.agents().stream().filter(a -> a.status() == AgentStatus.ACTIVE).count();
            totalTasks += arena.graph().effectiveTasks().size();
            completedTasks += (int) arena.graph().countByStatus(TaskStatus.COMPLETED);
        }
        return new CoordinatorStatus(activeObjectives, activeAgents, totalTasks, completedTasks, patternStore.stats());
    }

    public synchronized Optional<ObjectiveArena> getArena(String objectiveId) {
        return Optional.ofNullable(arenas.get(objectiveId));
    }

    public synchronized List<ObjectiveArena> listObjectives() {
        return List.copyOf(arenas.values());
    }

    /**
     * Generates an objective id in the format OBJ-YYYY-NNNN.
     */
    public String generateObjectiveId() {
        String id;
        do {
            int count = objectiveCounter.incrementAndGet();
            int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
            id = String.format("OBJ-%d-%04d", year, count);
        } while (arenas.containsKey(id));
        return id;
    }

    // -- Internals --

    private void completeObjective(ObjectiveArena arena) {
        arena.transition(ObjectiveStatus.COMPLETED);
        Instant now = clock.instant();
        long durationMs = Math.max(0, Duration.between(arena.createdAt(), now).toMillis());
        String taskType = arena.analysis().type().tag();
        List<AgentRole> roles = new ArrayList<>(new LinkedHashSet<>(
                arena.agents().stream().map(Agent::role).toList()));

        patternStore.recordTaskCompletion(new TaskHistoryEntry(arena.id(), arena.objective().description(),
                taskType, roles, true, durationMs, now));
        double successRate = patternStore.successRate(taskType);
        patternStore.storePattern(new Pattern(taskType, roles, successRate, durationMs, now, 1));

        arena.liveAgents().forEach(a -> arena.updateAgentStatus(a.id(), AgentStatus.COMPLETED));
        metrics.recordObjectiveResult(ObjectiveStatus.COMPLETED.name());
        publish(arena.id(), "objective.completed", Map.of(
                "durationMs", durationMs,
                "taskCount", arena.graph().effectiveTasks().size(),
                "agents", roles.stream().map(AgentRole::tag).toList()));
        log.info("Objective {} completed in {} ms", arena.id(), durationMs);
    }

    /**
     * Agents with unfinished assigned work are ACTIVE, agents whose assigned work is all
     * terminal are COMPLETED, the rest stay IDLE. Blocked agents are left alone.
     */
    private void refreshAgentStatuses(ObjectiveArena arena) {
        for (Agent agent : arena.liveAgents()) {
            if (agent.status() == AgentStatus.BLOCKED) {
                continue;
            }
            List<Task> own = arena.graph().tasksAssignedTo(agent.id()).stream()
                    .filter(t -> !arena.graph().isSuperseded(t.id()))
                    .toList();
            AgentStatus next;
            if (own.isEmpty()) {
                next = AgentStatus.IDLE;
            } else if (own.stream().allMatch(t -> t.status().isTerminal())) {
                next = AgentStatus.COMPLETED;
            } else {
                next = AgentStatus.ACTIVE;
            }
            arena.updateAgentStatus(agent.id(), next);
        }
    }

    private ObjectiveArena requireArena(String objectiveId) {
        ObjectiveArena arena = objectiveId != null ? arenas.get(objectiveId) : null;
        if (arena == null) {
            throw new ObjectiveNotFoundException(objectiveId);
        }
        return arena;
    }

    private ObjectiveArena requireActiveArena(String objectiveId) {
        ObjectiveArena arena = requireArena(objectiveId);
        if (arena.status().isTerminal()) {
            throw new InvalidTransitionException("Objective " + objectiveId + " is " + arena.status());
        }
        return arena;
    }

    private void publishTaskUpdate(ObjectiveArena arena, Task task) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("status", task.status().name());
        payload.put("content", task.content());
        arena.graph().assigneeOf(task.id()).ifPresent(agentId -> payload.put("agentId", agentId));
        if (task.failureReason() != null) {
            payload.put("reason", task.failureReason());
        }
        eventBus.publish(HivemindEvent.forTask("todo.updated", arena.id(), task.id(), payload));
    }

    private void publish(String objectiveId, String eventType, Map<String, Object> payload) {
        eventBus.publish(HivemindEvent.of(eventType, objectiveId, payload));
    }
}
