package com.logflow.anomaly.engine.model;

/**
 * How the statistical detector builds the expectation a bucket is compared against.
 */
public enum BaselineMode {
    /** Mean and deviation of every other bucket in the series. */
    LEAVE_ONE_OUT,
    /** Mean and deviation of the whole series, the evaluated bucket included. */
    INCLUSIVE
}
