package com.logflow.anomaly.engine.model;

/** The detectors an anomaly can originate from. Declaration order is the merge preference on full ties. */
public enum DetectorKind {
    STATISTICAL("Z-Score"),
    TREND("Moving Average"),
    PATTERN("Isolation Forest");

    private final String label;

    DetectorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
