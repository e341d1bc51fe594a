package com.gateflow.core.model;

/**
 * Kind of suite the generated tests belong to: browser page-object tests or API tests.
 */
public enum TestTarget {
    GUI,
    API
}
