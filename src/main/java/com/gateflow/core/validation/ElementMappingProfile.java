package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Element mapping: one mapping for every designed step that names a {@code target}, every
 * mapped step known to the design, confidences within [0, 100]. Quality is the mean
 * confidence, so a complete but low-confidence mapping passes with a reduced score.
 */
final class ElementMappingProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.ELEMENT_MAPPING;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("mappings", "pageObjectFile");
    }

    @Override
    public double quality(JsonNode output, UpstreamArtifacts upstream) {
        return meanConfidence(output);
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        JsonChecks.requirePath(output, "pageObjectFile", issues);
        JsonNode mappings = output.get("mappings");
        if (mappings == null || mappings.isNull()) {
            return;
        }
        if (!mappings.isArray()) {
            issues.major("'mappings' must be an array");
            return;
        }

        boolean designKnown = upstream != null && upstream.has(Gate.TEST_CASE_DESIGN);
        Set<String> designedSteps = designKnown ? allStepIds(upstream) : Set.of();
        Set<String> mapped = new HashSet<>();
        for (JsonNode mapping : mappings) {
            JsonNode stepId = mapping.get("stepId");
            if (!JsonChecks.isNonBlankText(stepId)) {
                issues.major("mapping without stepId");
                continue;
            }
            String id = stepId.asText();
            if (!mapped.add(id)) {
                issues.minor("step '" + id + "' is mapped more than once");
            }
            if (designKnown && !designedSteps.contains(id)) {
                issues.major("mapping references unknown step '" + id + "'");
            }
            JsonNode confidence = mapping.get("confidence");
            if (confidence == null || !confidence.isNumber()) {
                issues.minor("mapping for step '" + id + "' has no confidence");
            } else if (confidence.asDouble() < 0 || confidence.asDouble() > 100) {
                issues.minor("mapping for step '" + id + "' has confidence " + confidence.asText()
                        + " outside [0,100]");
            }
        }

        if (designKnown) {
            for (String stepId : targetedStepIds(upstream)) {
                if (!mapped.contains(stepId)) {
                    issues.major("step '" + stepId + "' has no element mapping");
                }
            }
        }
    }

    static double meanConfidence(JsonNode output) {
        double sum = 0;
        int count = 0;
        for (JsonNode mapping : output.path("mappings")) {
            JsonNode confidence = mapping.get("confidence");
            if (confidence != null && confidence.isNumber()) {
                sum += Math.max(0, Math.min(100, confidence.asDouble()));
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static Set<String> allStepIds(UpstreamArtifacts upstream) {
        Set<String> ids = new HashSet<>();
        for (JsonNode testCase : upstream.output(Gate.TEST_CASE_DESIGN).path("testCases")) {
            for (JsonNode step : testCase.path("steps")) {
                if (JsonChecks.isNonBlankText(step.get("id"))) {
                    ids.add(step.get("id").asText());
                }
            }
        }
        return ids;
    }

    private static Set<String> targetedStepIds(UpstreamArtifacts upstream) {
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode testCase : upstream.output(Gate.TEST_CASE_DESIGN).path("testCases")) {
            for (JsonNode step : testCase.path("steps")) {
                if (JsonChecks.isNonBlankText(step.get("id")) && JsonChecks.isNonBlankText(step.get("target"))) {
                    ids.add(step.get("id").asText());
                }
            }
        }
        return ids;
    }
}
