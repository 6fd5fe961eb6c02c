package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.QueenCoordinator;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.DecisionRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;

/**
 * CLI command: hivemind decide --objective "..." option1 option2 ...
 */
@Command(name = "decide", mixinStandardHelpOptions = true,
        description = "Pick the best option using pattern history")
@Component
public class DecideCommand implements Runnable {

    @Option(names = {"--objective", "-o"}, required = true, description = "What the decision should serve")
    private String objective;

    @Option(names = {"--failed", "-f"}, description = "Options that already failed")
    private List<String> failed;

    @Parameters(arity = "1..*", description = "Candidate options, in tie-break order")
    private List<String> options;

    private final QueenCoordinator coordinator;

    public DecideCommand(QueenCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Map<String, Object> state = failed != null ? Map.of("failedAttempts", failed) : Map.of();
        try {
            Decision decision = coordinator.makeDecision(new DecisionRequest(null, objective, state, options));
            ConsoleOutput.decision(decision);
        } catch (Exception e) {
            ConsoleOutput.error("Decision failed: " + e.getMessage());
        }
    }
}
