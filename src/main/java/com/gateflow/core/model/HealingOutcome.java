package com.gateflow.core.model;

public enum HealingOutcome {
    SUCCESS,
    FAILED
}
