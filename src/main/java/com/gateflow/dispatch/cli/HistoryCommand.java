package com.gateflow.dispatch.cli;

import com.gateflow.core.engine.PipelineCoordinator;
import com.gateflow.core.model.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: gateflow history
 * <p>
 * Lists stored pipelines: Request ID | Status | Domain/Feature | Completed gates.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List stored pipelines")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final PipelineCoordinator coordinator;

    public HistoryCommand(PipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<PipelineState> states = coordinator.history();
        if (states.isEmpty()) {
            ConsoleOutput.info("No pipelines found.");
            return;
        }

        List<PipelineState> display = states.size() > limit
                ? states.subList(states.size() - limit, states.size())
                : states;

        ConsoleOutput.info("Pipelines (" + display.size() + " of " + states.size() + "):");
        System.out.println();
        System.out.printf("  %-20s %-12s %-36s %s%n", "REQUEST ID", "STATUS", "PIPELINE", "GATES");
        System.out.println("  " + "-".repeat(80));

        for (PipelineState state : display) {
            var request = state.request();
            System.out.printf("  %-20s %-12s %-36s %s%n",
                    request.requestId(), state.status(),
                    truncate(request.domain() + "/" + request.feature(), 36),
                    state.completedGates());
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
