package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;

import java.util.List;

final class CodeGenerationProfile implements ValidationProfile {

    @Override
    public Gate gate() {
        return Gate.CODE_GENERATION;
    }

    @Override
    public List<String> requiredFields() {
        return List.of("compilationErrors", "testFiles");
    }

    @Override
    public void check(JsonNode output, UpstreamArtifacts upstream, ValidationIssues issues) {
        JsonNode errors = output.get("compilationErrors");
        if (errors != null && !errors.isNull()) {
            if (!errors.canConvertToInt()) {
                issues.major("'compilationErrors' must be a number");
            } else if (errors.asInt() > 0) {
                issues.major(errors.asInt() + " compilation error(s) in generated code");
            }
        }
        JsonNode files = output.get("testFiles");
        if (files != null && !files.isNull() && JsonChecks.texts(files).isEmpty()) {
            issues.major("no test files generated");
        }
    }
}
