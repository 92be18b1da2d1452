package com.logflow.anomaly.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BaselineStats {

    String metricName;
    String service;
    double mean;
    double stdDev;
    double minValue;
    double maxValue;
    int sampleCount;
    Instant computedAt;
}
