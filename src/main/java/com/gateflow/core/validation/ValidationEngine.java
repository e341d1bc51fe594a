package com.gateflow.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scores a gate's output against its {@link ValidationProfile}.
 * <p>
 * Pure and stateless: the same output, profile and upstream artifacts always give the same
 * result. {@code passed} is true exactly when no issue was found; the score carries the
 * finer-grained quality signal used for the SUCCESS/PARTIAL split.
 */
@Service
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    public ValidationResult validate(Gate gate, JsonNode output, UpstreamArtifacts upstream) {
        return validate(output, GateProfiles.forGate(gate), upstream);
    }

    public ValidationResult validate(JsonNode output, ValidationProfile profile, UpstreamArtifacts upstream) {
        if (output == null || output.isNull() || output.isMissingNode()) {
            return ValidationResult.failure("output is missing");
        }
        if (!output.isObject()) {
            return ValidationResult.failure("output is not a JSON object");
        }

        var issues = new ValidationIssues();
        List<String> required = profile.requiredFields();
        int present = 0;
        for (String field : required) {
            JsonNode value = output.get(field);
            if (value == null || value.isNull()) {
                issues.major("missing required field '" + field + "'");
            } else {
                present++;
            }
        }
        double completeness = required.isEmpty() ? 1.0 : (double) present / required.size();

        profile.check(output, upstream, issues);

        double quality = clamp(profile.quality(output, upstream));
        int score = (int) Math.round(quality * completeness) - issues.totalPenalty();
        score = Math.max(0, Math.min(100, score));

        log.debug("Validated {} output: quality={}, completeness={}, issues={}, score={}",
                profile.gate(), quality, completeness, issues.messages().size(), score);
        return new ValidationResult(score, issues.messages(), issues.isEmpty());
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(100, value));
    }
}
