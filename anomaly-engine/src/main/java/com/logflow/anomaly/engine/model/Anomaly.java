package com.logflow.anomaly.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single detection. Created per detection run and never mutated.
 */
@Value
@Builder
public class Anomaly {

    Instant detectedAt;
    String metricName;
    String service;
    AnomalyType anomalyType;
    String description;
    double score;
    Severity severity;
    double actualValue;
    double expectedValue;
    double deviationPercent;
    DetectorKind detector;
}
