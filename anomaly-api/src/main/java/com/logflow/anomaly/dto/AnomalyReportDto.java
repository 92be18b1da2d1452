package com.logflow.anomaly.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyReportDto {
    private Instant periodStart;
    private Instant periodEnd;
    private int totalAnomalies;
    private List<AnomalyDto> anomalies;
    private Map<String, Long> anomaliesBySeverity;
    private Map<String, Long> anomaliesByService;
}
