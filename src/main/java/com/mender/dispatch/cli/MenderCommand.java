package com.mender.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Mender.
 * Routes to subcommands: serve, stats, fixes, health.
 */
@Command(
        name = "mender",
        mixinStandardHelpOptions = true,
        version = "Mender 0.1.0",
        description = "Autonomous remediation of production anomalies",
        subcommands = {
                ServeCommand.class,
                StatsCommand.class,
                FixesCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MenderCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
