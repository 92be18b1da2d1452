package com.logflow.anomaly.engine.model;

/** Severity tiers, declared in ascending order so that {@code ordinal()} is the rank. */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isHigherThan(Severity other) {
        return compareTo(other) > 0;
    }
}
