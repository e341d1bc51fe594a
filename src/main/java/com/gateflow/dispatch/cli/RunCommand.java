package com.gateflow.dispatch.cli;

import com.gateflow.core.classify.ClassificationResult;
import com.gateflow.core.classify.RequestClassifier;
import com.gateflow.core.engine.InputValidationException;
import com.gateflow.core.engine.PipelineAlreadyRunningException;
import com.gateflow.core.engine.PipelineCoordinator;
import com.gateflow.core.events.EventBus;
import com.gateflow.core.model.PipelineResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: gateflow run (--file request.json | --text "...")
 * <p>
 * Classifies the input, runs the full pipeline and prints gate progress as it happens.
 * Exit code 0 for SUCCESS or PARTIAL, 1 for FAILED or an engine error, 2 when the input is
 * not a usable pipeline request.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a test-generation pipeline")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @Option(names = {"--file", "-f"}, description = "Request file (JSON or free text)")
        Path file;

        @Option(names = {"--text", "-t"}, description = "Request as JSON or free text")
        String text;
    }

    @Option(names = {"--quiet", "-q"}, description = "Do not print live progress")
    private boolean quiet;

    private final RequestClassifier classifier;
    private final PipelineCoordinator coordinator;
    private final EventBus eventBus;

    public RunCommand(RequestClassifier classifier, PipelineCoordinator coordinator, EventBus eventBus) {
        this.classifier = classifier;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String raw;
        try {
            raw = input.file != null ? Files.readString(input.file, StandardCharsets.UTF_8) : input.text;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + input.file + ": " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        ClassificationResult classification = classifier.classify(raw);
        if (!classification.pipelineRequest()) {
            ConsoleOutput.error("Not a pipeline request: " + classification.reason());
            classification.missing().forEach(m -> ConsoleOutput.error("  missing " + m));
            return EXIT_INVALID_INPUT;
        }

        var request = classification.request();
        ConsoleOutput.info("Pipeline " + request.domain() + "/" + request.feature() + " -> " + request.url());

        EventBus.Subscription subscription = quiet ? null : eventBus.subscribeAll(ConsoleOutput::event);
        PipelineResult result;
        try {
            result = coordinator.run(request);
        } catch (InputValidationException e) {
            ConsoleOutput.error("Invalid request:");
            e.getViolations().forEach(v -> ConsoleOutput.error("  " + v));
            return EXIT_INVALID_INPUT;
        } catch (PipelineAlreadyRunningException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Pipeline failed: " + rootCauseMessage(e));
            return EXIT_FAILED;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        ConsoleOutput.result(result);
        return exitCodeFor(result);
    }

    static int exitCodeFor(PipelineResult result) {
        return switch (result.status()) {
            case SUCCESS, PARTIAL -> EXIT_OK;
            default -> EXIT_FAILED;
        };
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
