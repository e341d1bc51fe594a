package com.gateflow.core.engine;

import java.util.List;

/**
 * The request cannot be accepted. Thrown before any state is written.
 */
public class InputValidationException extends RuntimeException {

    private final List<String> violations;

    public InputValidationException(List<String> violations) {
        super("Invalid pipeline request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
