package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Test case design: at least one test case, each with an id and at least one step, step ids
 * unique across the design. Quality is the share of acceptance criteria that some test case
 * references through its {@code criteria} list (1-based indices).
 */
final class TestCaseDesignProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.TEST_CASE_DESIGN;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("testCases");
    }

    @Override
    public double quality(JsonNode output, UpstreamArtifacts upstream) {
        int total = criteriaCount(upstream);
        if (total == 0) {
            return 100.0;
        }
        Set<Integer> covered = coveredCriteria(output, total);
        return 100.0 * covered.size() / total;
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        JsonNode testCases = output.get("testCases");
        if (testCases == null || testCases.isNull()) {
            return;
        }
        if (!testCases.isArray()) {
            issues.major("'testCases' must be an array");
            return;
        }
        if (testCases.isEmpty()) {
            issues.major("no test cases designed");
            return;
        }

        Set<String> testIds = new HashSet<>();
        Set<String> stepIds = new HashSet<>();
        int total = criteriaCount(upstream);
        int position = 0;
        for (JsonNode testCase : testCases) {
            position++;
            JsonNode id = testCase.get("id");
            String label = JsonChecks.isNonBlankText(id) ? id.asText() : "#" + position;
            if (!JsonChecks.isNonBlankText(id)) {
                issues.major("test case " + label + " has no id");
            } else if (!testIds.add(id.asText())) {
                issues.minor("duplicate test case id '" + id.asText() + "'");
            }

            JsonNode steps = testCase.get("steps");
            if (steps == null || !steps.isArray() || steps.isEmpty()) {
                issues.major("test case " + label + " has no steps");
                continue;
            }
            for (JsonNode step : steps) {
                JsonNode stepId = step.get("id");
                if (!JsonChecks.isNonBlankText(stepId)) {
                    issues.major("test case " + label + " has a step without id");
                } else if (!stepIds.add(stepId.asText())) {
                    issues.major("duplicate step id '" + stepId.asText() + "'");
                }
            }

            for (JsonNode ref : testCase.path("criteria")) {
                if (!ref.canConvertToInt() || ref.asInt() < 1 || ref.asInt() > total) {
                    issues.minor("test case " + label + " references unknown acceptance criterion " + ref.asText());
                }
            }
        }
    }

    static Set<Integer> coveredCriteria(JsonNode output, int total) {
        Set<Integer> covered = new HashSet<>();
        for (JsonNode testCase : output.path("testCases")) {
            for (JsonNode ref : testCase.path("criteria")) {
                if (ref.canConvertToInt() && ref.asInt() >= 1 && ref.asInt() <= total) {
                    covered.add(ref.asInt());
                }
            }
        }
        return covered;
    }

    private static int criteriaCount(UpstreamArtifacts upstream) {
        if (upstream == null || upstream.request() == null) {
            return 0;
        }
        return upstream.request().acceptanceCriteria().size();
    }
}
