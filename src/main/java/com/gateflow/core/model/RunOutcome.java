package com.gateflow.core.model;

import java.io.Serializable;

/**
 * Outcome of one execution run inside the healing loop.
 *
 * @param runNumber        1-based run counter
 * @param passed           true when every executed test passed
 * @param failureSignature deterministic digest of the failure; null for passing runs
 * @param passRate         percentage of executed tests that passed
 */
public record RunOutcome(
    int runNumber,
    boolean passed,
    String failureSignature,
    int passRate
) implements Serializable {}
