package com.gateflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Summary of the execution gate's run/heal cycle.
 *
 * @param runs             every run in order
 * @param attempts         every healing attempt in order
 * @param healingSucceeded true when at least one healing attempt happened and the final run passed
 * @param exhausted        true when the loop stopped because runs or healing attempts ran out
 */
public record HealingReport(
    List<RunOutcome> runs,
    List<HealingAttempt> attempts,
    boolean healingSucceeded,
    boolean exhausted
) implements Serializable {

    public HealingReport {
        runs = runs != null ? List.copyOf(runs) : List.of();
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    public static HealingReport empty() {
        return new HealingReport(List.of(), List.of(), false, false);
    }
}
