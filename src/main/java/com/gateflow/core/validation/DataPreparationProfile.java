package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.List;

/**
 * Test data: at least as many non-empty records as requested, written to a data file.
 */
final class DataPreparationProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.DATA_PREPARATION;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("records", "dataFile");
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        JsonNode records = output.get("records");
        if (records != null && !records.isNull()) {
            if (!records.isArray()) {
                issues.major("'records' must be an array");
            } else {
                int nonEmpty = 0;
                for (JsonNode record : records) {
                    if (record.isObject() && record.size() > 0) {
                        nonEmpty++;
                    }
                }
                int wanted = expectedCount(upstream);
                if (nonEmpty < wanted) {
                    issues.major("expected at least " + wanted + " non-empty records, got " + nonEmpty);
                }
                if (nonEmpty < records.size()) {
                    issues.minor((records.size() - nonEmpty) + " empty record(s)");
                }
            }
        }
        JsonChecks.requirePath(output, "dataFile", issues);
    }

    private static int expectedCount(UpstreamArtifacts upstream) {
        if (upstream == null || upstream.request() == null) {
            return 1;
        }
        var data = upstream.request().dataRequirements();
        return data.dataDriven() ? Math.max(1, data.count()) : 1;
    }
}
