package com.gateflow.core.model;

public enum AuthType {
    NONE,
    FORM,
    BASIC,
    TOKEN
}
