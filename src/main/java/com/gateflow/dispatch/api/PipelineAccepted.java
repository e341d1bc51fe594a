package com.gateflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a 202 response: where to poll for the pipeline that was just queued.
 */
public record PipelineAccepted(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("pipeline_key") String pipelineKey,
    String domain,
    String feature,
    String status
) {}
