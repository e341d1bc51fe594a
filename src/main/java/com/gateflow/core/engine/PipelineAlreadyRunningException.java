package com.gateflow.core.engine;

/**
 * A run for the same (domain, feature) key is already in progress in this process.
 */
public class PipelineAlreadyRunningException extends RuntimeException {

    private final String pipelineKey;

    public PipelineAlreadyRunningException(String pipelineKey) {
        super("Pipeline " + pipelineKey + " is already running");
        this.pipelineKey = pipelineKey;
    }

    public String getPipelineKey() {
        return pipelineKey;
    }
}
