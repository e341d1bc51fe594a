package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.List;

final class LearningCaptureProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.LEARNING_CAPTURE;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("learnings", "learningFile");
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        if (output.has("learnings") && !output.get("learnings").isNull() && !JsonChecks.hasArray(output, "learnings")) {
            issues.major("'learnings' must be an array");
        }
        JsonChecks.requirePath(output, "learningFile", issues);
    }
}
