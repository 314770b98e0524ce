package com.warden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Warden.
 * Routes to subcommands: run, audit, integrity, serve.
 */
@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        version = "Warden 0.1.0",
        description = "Runs agent plans with every risky action held for confirmation",
        subcommands = {
                RunCommand.class,
                AuditCommand.class,
                IntegrityCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WardenCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
