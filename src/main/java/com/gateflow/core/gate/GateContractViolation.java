package com.gateflow.core.gate;

import com.gateflow.core.model.Gate;

/**
 * A gate was asked to run without the durable output of a required predecessor.
 * <p>
 * Indicates a sequencing bug, never a worker problem, so it is never retried.
 */
public class GateContractViolation extends RuntimeException {

    private final Gate gate;
    private final Gate missing;

    public GateContractViolation(Gate gate, Gate missing, String key) {
        super(gate + " requires the output of " + missing + " but no record exists under '" + key + "'");
        this.gate = gate;
        this.missing = missing;
    }

    public Gate getGate() {
        return gate;
    }

    public Gate getMissing() {
        return missing;
    }
}
