package com.hivemind.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.artifact.ArtifactGenerator;
import com.hivemind.artifact.ArtifactRequest;
import com.hivemind.artifact.GeneratedArtifact;
import com.hivemind.core.analysis.ObjectiveAnalyzer;
import com.hivemind.core.assignment.CapabilityMatcher;
import com.hivemind.core.config.HivemindProperties;
import com.hivemind.core.decision.DecisionEngine;
import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.graph.IntakeGraph;
import com.hivemind.core.health.HealthCheckService;
import com.hivemind.core.health.HealthStatus;
import com.hivemind.core.memory.InMemoryPatternStore;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.monitor.ProgressMonitor;
import com.hivemind.core.nodes.AnalyzeObjectiveNode;
import com.hivemind.core.nodes.BuildTaskGraphNode;
import com.hivemind.core.nodes.PlanExecutionNode;
import com.hivemind.core.planning.TaskGraphBuilder;
import com.hivemind.core.remediation.PermissionRemediator;
import com.hivemind.core.scheduler.ParallelizationPlanner;
import com.hivemind.execution.WaveExecutor;
import com.hivemind.platform.PlatformClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli directly without a Spring context, against a real coordinator backed by
 * an in-memory pattern store and a mocked artifact backend.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private QueenCoordinator coordinator;
    private WaveExecutor waveExecutor;
    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() throws Exception {
        var properties = new HivemindProperties();
        var store = new InMemoryPatternStore(new ObjectMapper().findAndRegisterModules(), 1000, 5);
        var eventBus = new EventBus();
        var metrics = new HivemindMetrics(new SimpleMeterRegistry());
        var matcher = new CapabilityMatcher();
        var planner = new ParallelizationPlanner(matcher);
        var intakeGraph = new IntakeGraph(
                new AnalyzeObjectiveNode(new ObjectiveAnalyzer(store)),
                new BuildTaskGraphNode(new TaskGraphBuilder()),
                new PlanExecutionNode(planner));
        coordinator = new QueenCoordinator(intakeGraph, planner, matcher, new ProgressMonitor(properties),
                new DecisionEngine(store), new PermissionRemediator(), store, eventBus, metrics, properties);

        ArtifactGenerator generator = mock(ArtifactGenerator.class);
        when(generator.generate(any(ArtifactRequest.class))).thenAnswer(inv -> {
            ArtifactRequest request = inv.getArgument(0);
            return new GeneratedArtifact(request.targetTable(), "artifact-" + request.taskId(), Map.of(), "ok");
        });
        waveExecutor = new WaveExecutor(coordinator, generator, mock(PlatformClient.class), store, eventBus,
                metrics, properties);

        healthCheckService = mock(HealthCheckService.class);
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("intake-graph", HealthStatus.Status.UP, "Intake graph compiled and available", Map.of()),
                new HealthStatus("pattern-store", HealthStatus.Status.UP, "Pattern store available", Map.of()),
                new HealthStatus("platform", HealthStatus.Status.DEGRADED, "No platform endpoint configured", Map.of())));
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(coordinator, waveExecutor);
                }
                if (cls == DecideCommand.class) {
                    return (K) new DecideCommand(coordinator);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(coordinator);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new HivemindCommand(), factory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("top-level command")
    class TopLevel {

        @Test
        @DisplayName("no arguments prints usage with every subcommand")
        void usage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            for (String sub : List.of("plan", "decide", "status", "health", "serve")) {
                assertTrue(result.output().contains(sub), "usage should list " + sub);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Hivemind 0.1.0"));
        }
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("prints the analysis, tasks and parallel plan")
        void planWidget() {
            CliResult result = execute("plan", "create a widget to show open incidents with a chart");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Type: interactive-component"));
            assertTrue(result.output().contains("OBJECTIVE OBJ-"));
            assertTrue(result.output().contains("Strategy: PARALLEL"));
            assertTrue(result.output().contains("[WAVE 1]"));
            assertTrue(result.output().contains("[AGENT researcher]"));
        }

        @Test
        @DisplayName("--execute runs the objective to completion")
        void planAndExecute() {
            CliResult result = execute("plan", "--execute", "create a widget to show open incidents with a chart");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("[WAVE 6 COMPLETE]"));
            assertTrue(result.output().contains("Final status: COMPLETED"));
        }

        @Test
        @DisplayName("rejects an unknown priority")
        void invalidPriority() {
            CliResult result = execute("plan", "--priority", "URGENT", "write a script");

            assertTrue(result.output().contains("Invalid priority: URGENT"));
            assertTrue(coordinator.listObjectives().isEmpty());
        }

        @Test
        @DisplayName("missing objective is a usage error")
        void missingObjective() {
            assertEquals(2, execute("plan").exitCode());
        }
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("without history the first option wins")
        void firstOptionOnTie() {
            CliResult result = execute("decide", "-o", "widget for incidents", "spawn_widget_creator", "spawn_script_writer");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Decision: spawn_widget_creator"));
        }

        @Test
        @DisplayName("options are required")
        void optionsRequired() {
            assertEquals(2, execute("decide", "-o", "anything").exitCode());
        }
    }

    @Test
    @DisplayName("status reports objectives and tasks")
    void status() {
        execute("plan", "create a widget to show open incidents with a chart");

        CliResult result = execute("status");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("Active objectives: 1"));
        assertTrue(result.output().contains("Tasks: 0/8 completed"));
    }

    @Test
    @DisplayName("health reports a degraded platform")
    void health() {
        CliResult result = execute("health");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("platform: No platform endpoint configured"));
        assertTrue(result.output().contains("Overall: one or more components degraded or down"));
    }
}
