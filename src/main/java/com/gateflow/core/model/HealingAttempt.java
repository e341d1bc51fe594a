package com.gateflow.core.model;

import java.io.Serializable;

/**
 * One invocation of the healing worker inside the execution gate.
 *
 * @param attemptNumber               1-based, never above the configured maximum
 * @param triggeringFailureSignature  signature of the repeated failure that triggered healing
 * @param outcome                     what the healing worker reported
 * @param summary                     worker-provided description of the patch, or the failure reason
 */
public record HealingAttempt(
    int attemptNumber,
    String triggeringFailureSignature,
    HealingOutcome outcome,
    String summary
) implements Serializable {}
