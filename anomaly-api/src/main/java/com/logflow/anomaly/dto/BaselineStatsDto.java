package com.logflow.anomaly.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BaselineStatsDto {
    private String metricName;
    private String service;
    private double mean;
    private double stdDev;
    private double minValue;
    private double maxValue;
    private int sampleCount;
    private Instant lastUpdated;
}
