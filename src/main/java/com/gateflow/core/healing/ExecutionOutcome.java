package com.gateflow.core.healing;

import com.gateflow.core.model.GateResult;
import com.gateflow.core.model.HealingReport;

/**
 * Final result of the execution gate together with its run/heal history.
 */
public record ExecutionOutcome(GateResult result, HealingReport report) {}
