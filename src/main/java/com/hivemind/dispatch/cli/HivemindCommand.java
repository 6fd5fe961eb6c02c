package com.hivemind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Hivemind.
 * Routes to subcommands: plan, decide, status, health, serve.
 */
@Command(
        name = "hivemind",
        mixinStandardHelpOptions = true,
        version = "Hivemind 0.1.0",
        description = "Objective decomposition and agent coordination engine",
        subcommands = {
                PlanCommand.class,
                DecideCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HivemindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
