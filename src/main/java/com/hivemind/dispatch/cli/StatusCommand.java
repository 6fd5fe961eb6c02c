package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.model.CoordinatorStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hivemind status
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show coordinator status")
@Component
public class StatusCommand implements Runnable {

    private final QueenCoordinator coordinator;

    public StatusCommand(QueenCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        CoordinatorStatus status = coordinator.getStatus();
        ConsoleOutput.info("Active objectives: " + status.activeObjectives());
        ConsoleOutput.info("Active agents: " + status.activeAgents());
        ConsoleOutput.info("Tasks: " + status.completedTasks() + "/" + status.totalTasks() + " completed");
        ConsoleOutput.info(String.format("Memory: %d patterns, %d history entries, %.0f%% success",
                status.memory().patternCount(), status.memory().historyCount(),
                status.memory().overallSuccessRate() * 100));
    }
}
