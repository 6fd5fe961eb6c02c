package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.ObjectiveArena;
import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.Priority;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.planning.TaskGraph;
import com.hivemind.execution.WaveExecutor;
import com.hivemind.execution.WaveOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CLI command: hivemind plan "&lt;objective&gt;"
 * <p>
 * Analyzes an objective, prints its task graph, execution plan and agents, and optionally
 * executes it wave by wave.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Analyze and plan an objective")
@Component
public class PlanCommand implements Runnable {

    @Parameters(index = "0", description = "Free-text objective")
    private String description;

    @Option(names = {"--priority", "-p"}, description = "LOW, MEDIUM, HIGH or CRITICAL", defaultValue = "MEDIUM")
    private String priority;

    @Option(names = {"--constraint", "-c"}, description = "Constraint; role tags add agents to the roster")
    private List<String> constraints;

    @Option(names = {"--execute", "-x"}, description = "Execute the plan after spawning agents")
    private boolean execute;

    @Option(names = "--max-waves", description = "Upper bound on executed waves", defaultValue = "20")
    private int maxWaves;

    private final QueenCoordinator coordinator;
    private final WaveExecutor waveExecutor;

    public PlanCommand(QueenCoordinator coordinator, WaveExecutor waveExecutor) {
        this.coordinator = coordinator;
        this.waveExecutor = waveExecutor;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Priority parsedPriority;
        try {
            parsedPriority = Priority.valueOf(priority.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid priority: " + priority + ". Valid: LOW, MEDIUM, HIGH, CRITICAL");
            return;
        }

        var objective = new Objective(coordinator.generateObjectiveId(), description, parsedPriority,
                constraints != null ? new LinkedHashSet<>(constraints) : null, Map.of());
        ConsoleOutput.info("Analyzing objective...");

        TaskAnalysis analysis;
        try {
            analysis = coordinator.analyzeObjective(objective);
        } catch (Exception e) {
            ConsoleOutput.error("Analysis failed: " + rootCauseMessage(e));
            return;
        }
        ObjectiveArena arena = coordinator.getArena(objective.id()).orElseThrow();

        ConsoleOutput.info(String.format("Type: %s | Complexity: %d | Roster: %s",
                analysis.type().tag(), analysis.estimatedComplexity(),
                analysis.requiredCapabilities().stream().map(AgentRole::tag).collect(Collectors.joining(", "))));
        if (!analysis.dependencies().isEmpty()) {
            ConsoleOutput.info("Platform dependencies: " + String.join(", ", analysis.dependencies()));
        }
        analysis.suggested().ifPresent(p -> ConsoleOutput.info(String.format(
                "Suggested pattern: %s (success %.0f%%, used %d times)",
                p.agentSequence().stream().map(AgentRole::tag).collect(Collectors.joining(" → ")),
                p.successRate() * 100, p.useCount())));

        System.out.println();
        System.out.println("OBJECTIVE " + arena.id() + " [" + arena.status() + "]");
        printTasks(arena.graph());
        arena.lastPlan().ifPresent(ConsoleOutput::plan);
        for (Agent agent : arena.agents()) {
            ConsoleOutput.agent(agent.role().tag(), agent.id() + " " + agent.status()
                    + (agent.isSpecialist() ? " (specialist)" : ""));
        }

        if (execute) {
            if (arena.agents().isEmpty()) {
                coordinator.spawnAgents(arena.id());
            }
            try {
                for (WaveOutcome outcome : waveExecutor.runToCompletion(arena.id(), maxWaves)) {
                    ConsoleOutput.waveComplete(outcome);
                }
            } catch (Exception e) {
                ConsoleOutput.error("Execution failed: " + rootCauseMessage(e));
            }
            ConsoleOutput.progress(coordinator.monitorProgress(arena.id()));
            ConsoleOutput.info("Final status: " + arena.status());
        }
    }

    private static void printTasks(TaskGraph graph) {
        for (Task task : graph.tasks()) {
            ConsoleOutput.task(task.id(), task.status().name(), task.content(), graph.assigneeOf(task.id()).orElse(null));
            if (!graph.dependenciesOf(task.id()).isEmpty()) {
                System.out.println("      after " + String.join(", ", graph.dependenciesOf(task.id())));
            }
        }
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
