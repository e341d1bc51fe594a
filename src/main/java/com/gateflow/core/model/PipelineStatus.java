package com.gateflow.core.model;

/**
 * Lifecycle status of a pipeline run.
 */
public enum PipelineStatus {
    IN_PROGRESS,
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
