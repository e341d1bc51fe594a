package com.gateflow.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Payload handed to an external worker.
 *
 * @param metadata identifies the run and the target
 * @param gate     gate index the worker is fulfilling
 * @param worker   worker name, e.g. {@code element-mapper}
 * @param fields   gate-specific input fields
 * @param upstream durable outputs of the predecessor gates, keyed {@code gate{N}}
 */
public record WorkerRequest(
    Metadata metadata,
    int gate,
    String worker,
    JsonNode fields,
    JsonNode upstream
) {

    public record Metadata(String requestId, String domain, String feature, String url) {}
}
