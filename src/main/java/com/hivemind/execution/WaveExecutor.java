package com.hivemind.execution;

import com.hivemind.artifact.ArtifactGenerator;
import com.hivemind.artifact.ArtifactRequest;
import com.hivemind.artifact.GeneratedArtifact;
import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.engine.DispatchTicket;
import com.hivemind.core.engine.ObjectiveArena;
import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.error.ExecutionFailureException;
import com.hivemind.core.error.InvalidTransitionException;
import com.hivemind.core.error.ObjectiveNotFoundException;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.memory.PatternStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.ExecutionErrorContext;
import com.hivemind.core.model.ProgressReport;
import com.hivemind.platform.PlatformClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes ready tasks of an objective wave by wave.
 * <p>
 * Each ticket of a wave generates its artifact and, when a platform is configured, writes
 * it as a record. Tickets run concurrently on a pool bounded by the concurrency cap; their
 * outcomes are reported back to the coordinator one by one on the calling thread, in queue
 * order.
 */
@Service
public class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    private final QueenCoordinator coordinator;
    private final ArtifactGenerator artifactGenerator;
    private final PlatformClient platformClient;
    private final PatternStore patternStore;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final HivemindProperties properties;

    private final AtomicInteger threadCounter = new AtomicInteger();

    public WaveExecutor(QueenCoordinator coordinator, ArtifactGenerator artifactGenerator,
                        PlatformClient platformClient, PatternStore patternStore, EventBus eventBus,
                        HivemindMetrics metrics, HivemindProperties properties) {
        this.coordinator = coordinator;
        this.artifactGenerator = artifactGenerator;
        this.platformClient = platformClient;
        this.patternStore = patternStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    private record TaskResult(String taskId, GeneratedArtifact artifact, String recordId) {}

    /**
     * Runs one wave: the ready tasks whose assignee can take work, at most the concurrency cap.
     *
     * @return the wave outcome, {@link WaveOutcome#isEmpty() empty} when nothing was ready
     */
    public WaveOutcome executeWave(String objectiveId) {
        ObjectiveArena arena = coordinator.getArena(objectiveId)
                .orElseThrow(() -> new ObjectiveNotFoundException(objectiveId));
        int cap = Math.max(1, properties.getMaxConcurrentAgents());
        List<DispatchTicket> tickets = coordinator.nextWave(objectiveId, cap);
        if (tickets.isEmpty()) {
            log.info("No dispatchable tasks for objective {}", objectiveId);
            return WaveOutcome.empty(objectiveId);
        }

        int waveNumber = tickets.get(0).waveNumber();
        MdcContext.setWave(objectiveId, waveNumber);
        long startMs = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(cap, tickets.size()), r -> {
            Thread t = new Thread(r, "hivemind-wave-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            for (DispatchTicket ticket : tickets) {
                coordinator.reportTaskStarted(objectiveId, ticket.task().id(), ticket.agent().id());
            }
            eventBus.publish(HivemindEvent.of("wave.started", objectiveId, Map.of(
                    "waveNumber", waveNumber,
                    "tasks", tickets.stream().map(t -> t.task().id()).toList())));
            log.info("Wave {} dispatching {} tasks", waveNumber, tickets.size());

            var futures = new ArrayList<CompletableFuture<TaskResult>>();
            for (DispatchTicket ticket : tickets) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> execute(arena, ticket), executor)
                        .orTimeout(properties.getExecution().getTaskTimeoutSeconds(), TimeUnit.SECONDS));
            }

            int completed = 0;
            int failed = 0;
            int remediated = 0;
            for (int i = 0; i < tickets.size(); i++) {
                DispatchTicket ticket = tickets.get(i);
                try {
                    TaskResult result = futures.get(i).join();
                    coordinator.reportTaskCompleted(objectiveId, result.taskId());
                    completed++;
                } catch (CompletionException e) {
                    Throwable cause = unwrap(e, ticket);
                    var context = new ExecutionErrorContext(objectiveId, ticket.agent().id(), ticket.task().id(),
                            "execute", arena.analysis().type().tag());
                    if (coordinator.handleExecutionError(cause, context)) {
                        remediated++;
                    } else {
                        failed++;
                    }
                } catch (InvalidTransitionException e) {
                    log.warn("Objective {} stopped accepting results: {}", objectiveId, e.getMessage());
                    break;
                }
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            metrics.recordWaveExecution(tickets.size(), elapsedMs);
            eventBus.publish(HivemindEvent.of("wave.completed", objectiveId, Map.of(
                    "waveNumber", waveNumber,
                    "completed", completed,
                    "failed", failed,
                    "remediated", remediated)));
            log.info("Wave {} done in {} ms: {} completed, {} failed, {} remediated",
                    waveNumber, elapsedMs, completed, failed, remediated);
            return new WaveOutcome(objectiveId, waveNumber, tickets.size(), completed, failed, remediated, elapsedMs);
        } finally {
            executor.shutdownNow();
            MdcContext.clear();
        }
    }

    /**
     * Runs waves until nothing is dispatchable or {@code maxWaves} waves ran, then refreshes
     * the progress report.
     */
    public List<WaveOutcome> runToCompletion(String objectiveId, int maxWaves) {
        var outcomes = new ArrayList<WaveOutcome>();
        while (outcomes.size() < maxWaves) {
            WaveOutcome outcome = executeWave(objectiveId);
            if (outcome.isEmpty()) {
                break;
            }
            outcomes.add(outcome);
            boolean finished = coordinator.getArena(objectiveId)
                    .map(a -> a.status().isTerminal())
                    .orElse(true);
            if (finished) {
                break;
            }
        }
        ProgressReport report = coordinator.monitorProgress(objectiveId);
        log.info("Objective {} at {}% after {} waves", objectiveId,
                String.format("%.1f", report.overallProgress()), outcomes.size());
        return outcomes;
    }

    private TaskResult execute(ObjectiveArena arena, DispatchTicket ticket) {
        String taskId = ticket.task().id();
        MdcContext.setTask(ticket.objectiveId(), taskId, ticket.agent().role().tag());
        try {
            log.info("Executing task {} [{}]: {}", taskId, ticket.agent().role().tag(), ticket.task().content());
            var request = new ArtifactRequest(ticket.objectiveId(), taskId, arena.objective().description(),
                    ticket.task().content(), arena.analysis().type(), ticket.agent().role());
            GeneratedArtifact artifact = artifactGenerator.generate(request);

            String recordId = null;
            if (platformClient.isConfigured()) {
                var fields = new LinkedHashMap<String, Object>(artifact.fields());
                fields.putIfAbsent("name", artifact.name());
                recordId = platformClient.createRecord(artifact.table(), fields);
            }

            var stored = new LinkedHashMap<String, Object>();
            stored.put("taskId", taskId);
            stored.put("agentId", ticket.agent().id());
            stored.put("artifact", artifact);
            if (recordId != null) {
                stored.put("recordId", recordId);
            }
            patternStore.store("artifact_" + taskId, stored);
            return new TaskResult(taskId, artifact, recordId);
        } finally {
            MdcContext.clear();
        }
    }

    private Throwable unwrap(CompletionException e, DispatchTicket ticket) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            return new ExecutionFailureException("Task " + ticket.task().id() + " timed out after "
                    + properties.getExecution().getTaskTimeoutSeconds() + " seconds", cause);
        }
        return cause;
    }
}
