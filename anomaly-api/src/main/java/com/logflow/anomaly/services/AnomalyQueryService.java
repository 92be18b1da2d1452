package com.logflow.anomaly.services;

import com.logflow.anomaly.dto.AnomalyDto;
import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.dto.BaselineStatsDto;
import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyReport;
import com.logflow.anomaly.engine.model.BaselineStats;
import com.logflow.anomaly.engine.model.DetectionRequest;
import com.logflow.anomaly.engine.model.Metrics;
import com.logflow.anomaly.engine.service.AnomalyReportBuilder;
import com.logflow.anomaly.engine.service.BaselineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyQueryService {

    static final int MIN_WINDOW_MINUTES = 10;
    static final int MAX_WINDOW_MINUTES = 1440;

    private final AnomalyReportBuilder anomalyReportBuilder;
    private final BaselineService baselineService;
    private final DetectionSettingsService detectionSettingsService;

    public List<AnomalyDto> detect(String metricName, String service, Integer windowMinutes,
                                   Integer bucketMinutes, Double sensitivity) {
        log.info("---Start {} anomaly detection, service={}, window={}", metricName, service, windowMinutes);
        DetectionRequest request = request(List.of(metricName), service, windowMinutes, bucketMinutes, sensitivity);
        List<AnomalyDto> anomalies = anomalyReportBuilder.detect(request).stream()
                .map(AnomalyQueryService::toDto)
                .toList();
        log.info("--- {} anomaly detection completed: {} anomalies", metricName, anomalies.size());
        return anomalies;
    }

    public AnomalyReportDto report(String service, Integer windowMinutes, Integer bucketMinutes, Double sensitivity) {
        DetectionRequest request = request(Metrics.SUPPORTED, service, windowMinutes, bucketMinutes, sensitivity);
        AnomalyReport report = anomalyReportBuilder.build(request);
        return AnomalyReportDto.builder()
                .periodStart(report.getPeriodStart())
                .periodEnd(report.getPeriodEnd())
                .totalAnomalies(report.getTotalAnomalies())
                .anomalies(report.getAnomalies().stream().map(AnomalyQueryService::toDto).toList())
                .anomaliesBySeverity(report.getAnomaliesBySeverity())
                .anomaliesByService(report.getAnomaliesByService())
                .build();
    }

    public BaselineStatsDto baseline(String metricName, String service, Integer windowMinutes, Integer bucketMinutes) {
        DetectionRequest request = request(List.of(metricName), service, windowMinutes, bucketMinutes, null);
        BaselineStats baseline = baselineService.calculateBaseline(request);
        return BaselineStatsDto.builder()
                .metricName(baseline.getMetricName())
                .service(baseline.getService())
                .mean(baseline.getMean())
                .stdDev(baseline.getStdDev())
                .minValue(baseline.getMinValue())
                .maxValue(baseline.getMaxValue())
                .sampleCount(baseline.getSampleCount())
                .lastUpdated(baseline.getComputedAt())
                .build();
    }

    private DetectionRequest request(List<String> metricNames, String service, Integer windowMinutes,
                                     Integer bucketMinutes, Double sensitivity) {
        int window = windowMinutes != null ? windowMinutes : detectionSettingsService.windowMinutes();
        if (window < MIN_WINDOW_MINUTES || window > MAX_WINDOW_MINUTES) {
            throw new InvalidDetectionConfigException("window_minutes",
                    "must be in [" + MIN_WINDOW_MINUTES + ", " + MAX_WINDOW_MINUTES + "], got " + window);
        }
        return DetectionRequest.builder()
                .metricNames(metricNames)
                .service(service)
                .windowMinutes(window)
                .bucketMinutes(bucketMinutes != null ? bucketMinutes : detectionSettingsService.bucketMinutes())
                .config(detectionSettingsService.config(sensitivity))
                .build();
    }

    static AnomalyDto toDto(Anomaly anomaly) {
        return AnomalyDto.builder()
                .detectedAt(anomaly.getDetectedAt())
                .metricName(anomaly.getMetricName())
                .service(anomaly.getService())
                .anomalyType(anomaly.getAnomalyType().value())
                .description(anomaly.getDescription())
                .score(anomaly.getScore())
                .severity(anomaly.getSeverity().value())
                .actualValue(anomaly.getActualValue())
                .expectedValue(anomaly.getExpectedValue())
                .deviationPercent(anomaly.getDeviationPercent())
                .detector(anomaly.getDetector().name().toLowerCase(Locale.ROOT))
                .build();
    }
}
