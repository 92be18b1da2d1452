package com.logflow.anomaly.services;

import com.logflow.anomaly.dto.AnomalyDto;
import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyReport;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.DetectionRequest;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.Metrics;
import com.logflow.anomaly.engine.model.Severity;
import com.logflow.anomaly.engine.service.AnomalyReportBuilder;
import com.logflow.anomaly.engine.service.BaselineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyQueryServiceTest {

    private static final Instant DETECTED_AT = Instant.parse("2025-10-24T02:05:00Z");

    @Mock
    private AnomalyReportBuilder anomalyReportBuilder;

    @Mock
    private BaselineService baselineService;

    @Mock
    private DetectionSettingsService detectionSettingsService;

    private AnomalyQueryService anomalyQueryService;

    @BeforeEach
    void setUp() {
        anomalyQueryService = new AnomalyQueryService(anomalyReportBuilder, baselineService, detectionSettingsService);
    }

    private static Anomaly spike() {
        return Anomaly.builder()
                .detectedAt(DETECTED_AT)
                .metricName(Metrics.LOG_VOLUME)
                .service("payment-service")
                .anomalyType(AnomalyType.PATTERN_CHANGE)
                .description("log_volume pattern_change (Isolation Forest): 3000.00 (expected ~225.00)")
                .score(0.82)
                .severity(Severity.CRITICAL)
                .actualValue(3000)
                .expectedValue(225)
                .deviationPercent(1233.3)
                .detector(DetectorKind.PATTERN)
                .build();
    }

    @Test
    void detectUsesDefaultsAndSensitivityOverride() {
        when(detectionSettingsService.bucketMinutes()).thenReturn(1);
        when(detectionSettingsService.config(2.5)).thenReturn(DetectionConfig.builder().statisticalThreshold(2.5).build());
        when(anomalyReportBuilder.detect(any())).thenReturn(List.of(spike()));

        List<AnomalyDto> anomalies = anomalyQueryService.detect(Metrics.LOG_VOLUME, "payment-service", 120, null, 2.5);

        ArgumentCaptor<DetectionRequest> captor = ArgumentCaptor.forClass(DetectionRequest.class);
        verify(anomalyReportBuilder).detect(captor.capture());
        DetectionRequest request = captor.getValue();
        assertThat(request.getMetricNames()).containsExactly(Metrics.LOG_VOLUME);
        assertThat(request.getWindowMinutes()).isEqualTo(120);
        assertThat(request.getBucketMinutes()).isEqualTo(1);
        assertThat(request.getConfig().getStatisticalThreshold()).isEqualTo(2.5);

        assertThat(anomalies).singleElement().satisfies(dto -> {
            assertThat(dto.getAnomalyType()).isEqualTo("pattern_change");
            assertThat(dto.getSeverity()).isEqualTo("critical");
            assertThat(dto.getDetector()).isEqualTo("pattern");
            assertThat(dto.getDetectedAt()).isEqualTo(DETECTED_AT);
        });
    }

    @Test
    void reportCoversEverySupportedMetric() {
        when(detectionSettingsService.windowMinutes()).thenReturn(60);
        when(detectionSettingsService.bucketMinutes()).thenReturn(1);
        when(detectionSettingsService.config(null)).thenReturn(DetectionConfig.defaults());
        when(anomalyReportBuilder.build(any())).thenReturn(AnomalyReport.builder()
                .periodStart(DETECTED_AT.minusSeconds(3600))
                .periodEnd(DETECTED_AT)
                .anomalies(List.of(spike()))
                .totalAnomalies(1)
                .anomaliesBySeverity(Map.of("critical", 1L))
                .anomaliesByService(Map.of("payment-service", 1L))
                .build());

        AnomalyReportDto report = anomalyQueryService.report(null, null, null, null);

        ArgumentCaptor<DetectionRequest> captor = ArgumentCaptor.forClass(DetectionRequest.class);
        verify(anomalyReportBuilder).build(captor.capture());
        assertThat(captor.getValue().getMetricNames()).containsExactlyElementsOf(Metrics.SUPPORTED);
        assertThat(report.getTotalAnomalies()).isEqualTo(1);
        assertThat(report.getAnomalies()).hasSize(1);
        assertThat(report.getAnomaliesBySeverity()).containsEntry("critical", 1L);
    }

    @Test
    void rejectsWindowOutsideApiRange() {
        assertThatThrownBy(() -> anomalyQueryService.detect(Metrics.ERROR_RATE, null, 5, null, null))
                .isInstanceOf(InvalidDetectionConfigException.class)
                .hasMessageContaining("window_minutes");
        assertThatThrownBy(() -> anomalyQueryService.report(null, 2000, null, null))
                .isInstanceOf(InvalidDetectionConfigException.class);
        verifyNoInteractions(anomalyReportBuilder);
    }
}
