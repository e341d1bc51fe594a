package com.gateflow.dispatch.cli;

import com.gateflow.core.engine.PipelineCoordinator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: gateflow status &lt;domain&gt; &lt;feature&gt;
 * <p>
 * Reads the stored pipeline, gate and audit records and prints them without running anything.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the stored state of a pipeline")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Domain")
    private String domain;

    @Parameters(index = "1", description = "Feature")
    private String feature;

    private final PipelineCoordinator coordinator;

    public StatusCommand(PipelineCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var result = coordinator.status(domain, feature);
        if (result.isEmpty()) {
            ConsoleOutput.error("Pipeline not found: " + domain + "/" + feature);
            return;
        }
        ConsoleOutput.result(result.get());
    }
}
