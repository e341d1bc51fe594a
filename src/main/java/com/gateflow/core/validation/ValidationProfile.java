package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.List;

/**
 * Schema and semantic checks for one gate's output.
 * <p>
 * Implementations are stateless. {@link ValidationEngine} combines the three parts into a
 * score: {@code round(quality × completeness) − penalties}, clamped to [0, 100].
 */
public interface ValidationProfile {

    Gate gate();

    /** Top-level fields the output must carry. Drives the completeness share. */
    List<String> requiredFields();

    /**
     * Gate-specific quality measure in [0, 100]. Called only on a JSON object.
     */
    default double quality(JsonNode output, UpstreamArtifacts upstream) {
        return 100.0;
    }

    /**
     * Semantic checks beyond field presence. Missing required fields are reported by the
     * engine, so implementations skip checks on fields that are absent.
     */
    void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues);
}
