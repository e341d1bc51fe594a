package com.gateflow.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * JSON encoding of worker payloads shared by the transports.
 */
final class WorkerPayloads {

    private WorkerPayloads() {}

    static String encode(ObjectMapper objectMapper, WorkerRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new WorkerInvocationException(request.worker(), "could not encode request: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses and sanity-checks a worker answer.
     */
    static WorkerResponse decode(ObjectMapper objectMapper, String worker, String body) {
        if (body == null || body.isBlank()) {
            throw new WorkerInvocationException(worker, "empty response from " + worker);
        }
        WorkerResponse response;
        try {
            response = objectMapper.readValue(body, WorkerResponse.class);
        } catch (JsonProcessingException e) {
            throw new WorkerInvocationException(worker, "malformed response from " + worker + ": "
                    + e.getOriginalMessage(), e);
        }
        if (response == null || response.status() == null || response.status().isBlank()) {
            throw new WorkerInvocationException(worker, "malformed response from " + worker + ": missing status");
        }
        String status = response.status().toUpperCase(Locale.ROOT);
        if (!status.equals(WorkerResponse.SUCCESS) && !status.equals(WorkerResponse.PARTIAL)
                && !status.equals(WorkerResponse.FAILED)) {
            throw new WorkerInvocationException(worker, "malformed response from " + worker
                    + ": unknown status '" + response.status() + "'");
        }
        if (!response.isFailed() && !response.hasOutput()) {
            throw new WorkerInvocationException(worker, "malformed response from " + worker + ": missing output");
        }
        return new WorkerResponse(status, response.output(), response.validation());
    }
}
