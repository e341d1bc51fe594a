package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Compact per-gate view reported in the pipeline result.
 */
public record GateSummary(
    int gate,
    String worker,
    GateStatus status,
    int score,
    List<String> issues,
    long durationMs
) implements Serializable {

    public GateSummary {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static GateSummary of(GateResult result) {
        return new GateSummary(result.gate(), result.workerName(), result.status(),
                result.validation().score(), result.validation().issues(), result.durationMs());
    }
}
