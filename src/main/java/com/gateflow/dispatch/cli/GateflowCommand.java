package com.gateflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, resume, status, history, classify, serve.
 */
@Command(
        name = "gateflow",
        mixinStandardHelpOptions = true,
        version = "Gateflow 0.1.0",
        description = "Gate-based test generation and execution pipeline",
        subcommands = {
                RunCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                ClassifyCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GateflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
