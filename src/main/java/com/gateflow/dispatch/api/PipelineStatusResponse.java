package com.gateflow.dispatch.api;

import com.gateflow.core.model.PipelineResult;

/**
 * Stored view of a pipeline plus whether it is executing in this process right now.
 */
public record PipelineStatusResponse(boolean running, PipelineResult result) {}
