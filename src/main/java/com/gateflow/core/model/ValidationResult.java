package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of validating a gate's output.
 *
 * @param score  quality score in [0, 100]
 * @param issues ordered list of problems found; empty when the output is acceptable
 * @param passed true exactly when {@code issues} is empty
 */
public record ValidationResult(
    int score,
    List<String> issues,
    boolean passed
) implements Serializable {

    public ValidationResult {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public static ValidationResult failure(String issue) {
        return new ValidationResult(0, List.of(issue), false);
    }
}
