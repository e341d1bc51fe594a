package com.gateflow.core.engine;

public class PipelineNotFoundException extends RuntimeException {

    public PipelineNotFoundException(String pipelineKey) {
        super("No pipeline record under " + pipelineKey);
    }
}
