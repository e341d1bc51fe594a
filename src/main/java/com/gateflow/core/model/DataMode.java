package com.gateflow.core.model;

/**
 * How test data is supplied to generated tests.
 */
public enum DataMode {
    SINGLE,
    DATA_DRIVEN
}
