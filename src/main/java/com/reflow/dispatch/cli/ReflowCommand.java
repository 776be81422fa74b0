package com.reflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Reflow.
 * Routes to subcommands: run, memory.
 */
@Command(
        name = "reflow",
        mixinStandardHelpOptions = true,
        version = "Reflow 0.1.0",
        description = "Fault-injection harness for workflow recovery strategies",
        subcommands = {
                RunCommand.class,
                MemoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ReflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand: show usage
        new CommandLine(this).usage(System.out);
    }
}
