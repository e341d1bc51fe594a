package com.gateflow.core.model;

/**
 * Outcome of a single gate execution.
 * <p>
 * SUCCESS and PARTIAL both allow the pipeline to move forward; FAILED is a hard stop.
 */
public enum GateStatus {
    SUCCESS,
    PARTIAL,
    FAILED;

    public boolean allowsProgress() {
        return this != FAILED;
    }
}
