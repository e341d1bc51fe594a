package com.gateflow.core.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Serializable;
import java.time.Instant;

/**
 * Learnings captured by the last gate, stored under {@code {domain}-{feature}-learnings}
 * so later runs of the same feature can consult them.
 */
public record LearningsRecord(
    String requestId,
    String domain,
    String feature,
    JsonNode learnings,
    String learningFile,
    Instant recordedAt
) implements Serializable {}
