package com.logflow.anomaly.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyDto {
    private Instant detectedAt;
    private String metricName;
    private String service;
    private String anomalyType;
    private String description;
    private double score;
    private String severity;
    private double actualValue;
    private double expectedValue;
    private double deviationPercent;
    private String detector;
}
