package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Result returned to the caller of a pipeline run.
 *
 * @param status          terminal status, or IN_PROGRESS when the run was aborted between gates
 * @param requestId       id of the originating request
 * @param pipelineKey     state-store key of the pipeline record
 * @param executionTimeMs wall time of this invocation
 * @param gates           per-gate summaries in execution order
 * @param deliverables    produced artifact paths grouped by category (data, pageObjects, tests, learnings)
 * @param qualityMetrics  metrics computed by the final audit (or from the partial results of a halted run)
 * @param healing         execution gate run/heal summary
 * @param auditTrail      state-store key of the audit record
 * @param failedGate      index of the gate that halted the run, or null
 * @param issues          concrete issues behind a non-SUCCESS outcome
 * @param aborted         true when an abort signal stopped the run between gates
 */
public record PipelineResult(
    PipelineStatus status,
    String requestId,
    String pipelineKey,
    long executionTimeMs,
    List<GateSummary> gates,
    Map<String, List<String>> deliverables,
    QualityMetrics qualityMetrics,
    HealingReport healing,
    String auditTrail,
    Integer failedGate,
    List<String> issues,
    boolean aborted
) implements Serializable {

    public PipelineResult {
        gates = gates != null ? List.copyOf(gates) : List.of();
        deliverables = deliverables != null ? Map.copyOf(deliverables) : Map.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
