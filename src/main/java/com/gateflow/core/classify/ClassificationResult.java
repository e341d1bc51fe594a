package com.gateflow.core.classify;

import com.gateflow.core.model.PipelineRequest;

import java.util.List;

/**
 * Outcome of classifying raw input.
 *
 * @param pipelineRequest true when the input describes a test-generation request
 * @param request         the normalised request; null when {@code pipelineRequest} is false
 * @param reason          why the input was accepted or rejected
 * @param missing         required elements that could not be found in the input
 */
public record ClassificationResult(
    boolean pipelineRequest,
    PipelineRequest request,
    String reason,
    List<String> missing
) {

    public ClassificationResult {
        missing = missing != null ? List.copyOf(missing) : List.of();
    }

    public static ClassificationResult accepted(PipelineRequest request, String reason) {
        return new ClassificationResult(true, request, reason, List.of());
    }

    public static ClassificationResult rejected(String reason, List<String> missing) {
        return new ClassificationResult(false, null, reason, missing);
    }
}
