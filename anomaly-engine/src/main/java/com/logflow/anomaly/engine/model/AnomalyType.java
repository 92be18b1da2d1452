package com.logflow.anomaly.engine.model;

public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop"),
    PATTERN_CHANGE("pattern_change");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
