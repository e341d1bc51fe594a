package com.gateflow.dispatch.cli;

import com.gateflow.core.engine.PipelineAlreadyRunningException;
import com.gateflow.core.engine.PipelineCoordinator;
import com.gateflow.core.engine.PipelineNotFoundException;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.model.PipelineResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: gateflow resume &lt;domain&gt; &lt;feature&gt;
 * <p>
 * Continues an interrupted pipeline from its last durable state.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume an interrupted pipeline")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Domain")
    private String domain;

    @Parameters(index = "1", description = "Feature")
    private String feature;

    private final PipelineCoordinator coordinator;
    private final EventBus eventBus;

    public ResumeCommand(PipelineCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        PipelineResult result;
        try {
            result = coordinator.resume(domain, feature);
        } catch (PipelineNotFoundException | PipelineAlreadyRunningException e) {
            ConsoleOutput.error(e.getMessage());
            return RunCommand.EXIT_FAILED;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Resume failed: " + RunCommand.rootCauseMessage(e));
            return RunCommand.EXIT_FAILED;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.result(result);
        return RunCommand.exitCodeFor(result);
    }
}
