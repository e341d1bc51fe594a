package com.gateflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.time.Instant;

/**
 * Durable result of one gate execution, stored under {@code {domain}-{feature}-gate{N}-output}.
 * <p>
 * Never mutated after it is written. Re-running the gate writes a new value under the same key.
 *
 * @param gate        gate index (0-5)
 * @param workerName  worker that produced the output
 * @param status      SUCCESS, PARTIAL or FAILED
 * @param output      gate-specific payload returned by the worker; null when the invocation failed
 * @param validation  validation outcome
 * @param durationMs  wall time spent in the worker call and validation
 * @param completedAt when the result was produced
 */
public record GateResult(
    int gate,
    String workerName,
    GateStatus status,
    JsonNode output,
    ValidationResult validation,
    long durationMs,
    Instant completedAt
) implements Serializable {

    public Gate gateType() {
        return Gate.of(gate);
    }

    public boolean hasOutput() {
        return output != null && !output.isNull() && !output.isMissingNode();
    }
}
