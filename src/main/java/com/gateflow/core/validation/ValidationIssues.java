package com.gateflow.core.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered collector of validation issues with their score penalties.
 */
public class ValidationIssues {

    public enum Severity {
        /** Structural problem: the next gate cannot rely on the output. */
        MAJOR(25),
        /** Local inconsistency that leaves most of the output usable. */
        MINOR(10);

        private final int penalty;

        Severity(int penalty) {
            this.penalty = penalty;
        }

        public int penalty() {
            return penalty;
        }
    }

    private final List<String> messages = new ArrayList<>();
    private int penalty;

    public void major(String message) {
        add(Severity.MAJOR, message);
    }

    public void minor(String message) {
        add(Severity.MINOR, message);
    }

    public void add(Severity severity, String message) {
        messages.add(message);
        penalty += severity.penalty();
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }

    public int totalPenalty() {
        return penalty;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
