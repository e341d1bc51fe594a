package com.gateflow.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Payload returned by an external worker.
 *
 * @param status     SUCCESS, PARTIAL or FAILED as judged by the worker itself
 * @param output     gate-specific result payload
 * @param validation the worker's self-assessment; advisory, the pipeline validates independently
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkerResponse(
    String status,
    JsonNode output,
    Validation validation
) {

    public static final String SUCCESS = "SUCCESS";
    public static final String PARTIAL = "PARTIAL";
    public static final String FAILED = "FAILED";

    @JsonIgnore
    public boolean isFailed() {
        return FAILED.equalsIgnoreCase(status);
    }

    public boolean hasOutput() {
        return output != null && !output.isNull() && !output.isMissingNode();
    }

    /**
     * Issues the worker reported, never null.
     */
    public List<String> reportedIssues() {
        return validation != null && validation.issues() != null ? validation.issues() : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Validation(boolean passed, int score, List<String> issues) {}
}
