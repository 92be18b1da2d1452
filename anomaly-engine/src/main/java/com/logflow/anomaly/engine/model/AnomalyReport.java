package com.logflow.anomaly.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnomalyReport {

    public static final String ALL_SERVICES = "all";

    Instant periodStart;
    Instant periodEnd;
    List<Anomaly> anomalies;
    int totalAnomalies;
    Map<String, Long> anomaliesBySeverity;
    Map<String, Long> anomaliesByService;
}
