package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.List;

/**
 * Execution report consistency. Failing tests are not issues by themselves; they lower the
 * quality (the pass rate) instead.
 */
final class ExecutionProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.EXECUTION;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("total", "passed", "failed");
    }

    @Override
    public double quality(JsonNode output, UpstreamArtifacts upstream) {
        return passRate(output);
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        JsonNode total = output.get("total");
        JsonNode passed = output.get("passed");
        JsonNode failed = output.get("failed");
        if (total == null || passed == null || failed == null) {
            return;
        }
        if (!total.canConvertToInt() || !passed.canConvertToInt() || !failed.canConvertToInt()) {
            issues.major("'total', 'passed' and 'failed' must be numbers");
            return;
        }
        if (total.asInt() < 1) {
            issues.major("no tests were executed");
        }
        if (passed.asInt() + failed.asInt() != total.asInt()) {
            issues.major("passed (" + passed.asInt() + ") + failed (" + failed.asInt()
                    + ") does not equal total (" + total.asInt() + ")");
        }
        if (failed.asInt() > 0 && JsonChecks.texts(output.get("failedTests")).isEmpty()) {
            issues.minor("failures reported without 'failedTests'");
        }
    }

    static double passRate(JsonNode output) {
        int total = output.path("total").asInt(0);
        if (total < 1) {
            return 0.0;
        }
        int passed = output.path("passed").asInt(0);
        return 100.0 * Math.max(0, Math.min(passed, total)) / total;
    }
}
