package com.gateflow.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.gateflow.core.classify.RequestClassifier;
import com.gateflow.core.persistence.StateCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: gateflow classify "&lt;text&gt;"
 * <p>
 * Shows how free text or JSON would be turned into a pipeline request, without running it.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Classify input and print the normalised request")
@Component
public class ClassifyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Request as JSON or free text")
    private String text;

    private final RequestClassifier classifier;

    public ClassifyCommand(RequestClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public Integer call() throws JsonProcessingException {
        var result = classifier.classify(text);
        if (!result.pipelineRequest()) {
            ConsoleOutput.error("Not a pipeline request: " + result.reason());
            result.missing().forEach(m -> ConsoleOutput.error("  missing " + m));
            return RunCommand.EXIT_INVALID_INPUT;
        }
        ConsoleOutput.success("Pipeline request (" + result.reason() + ")");
        System.out.println(StateCodec.objectMapper().writerWithDefaultPrettyPrinter()
                .writeValueAsString(result.request()));
        return RunCommand.EXIT_OK;
    }
}
