package com.logflow.anomaly.controller;

import com.logflow.anomaly.dto.AnomalyDto;
import com.logflow.anomaly.dto.AnomalyReportDto;
import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import com.logflow.anomaly.services.AnomalyQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AnomalyController.class)
class AnomalyControllerTest {

    private static final Instant DETECTED_AT = Instant.parse("2025-10-24T02:05:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyQueryService anomalyQueryService;

    private static AnomalyDto spike() {
        return AnomalyDto.builder()
                .detectedAt(DETECTED_AT)
                .metricName("log_volume")
                .service("payment-service")
                .anomalyType("spike")
                .description("log_volume spike (Z-Score): 3000.00 (expected ~225.00)")
                .score(2.25)
                .severity("high")
                .actualValue(3000.0)
                .expectedValue(225.0)
                .deviationPercent(1233.3)
                .detector("statistical")
                .build();
    }

    @Test
    void logVolumeDetectionUsesSnakeCaseWireShape() throws Exception {
        when(anomalyQueryService.detect(eq("log_volume"), eq("payment-service"), eq(60), isNull(), isNull()))
                .thenReturn(List.of(spike()));

        mockMvc.perform(get("/api/v1/anomaly/detect/log-volume")
                        .param("service", "payment-service")
                        .param("window_minutes", "60"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].detected_at").value("2025-10-24T02:05:00Z"))
                .andExpect(jsonPath("$[0].metric_name").value("log_volume"))
                .andExpect(jsonPath("$[0].anomaly_type").value("spike"))
                .andExpect(jsonPath("$[0].severity").value("high"))
                .andExpect(jsonPath("$[0].actual_value").value(3000.0))
                .andExpect(jsonPath("$[0].expected_value").value(225.0))
                .andExpect(jsonPath("$[0].deviation_percent").value(1233.3));
    }

    @Test
    void errorRateDetectionPassesSensitivity() throws Exception {
        when(anomalyQueryService.detect(eq("error_rate"), isNull(), isNull(), eq(5), eq(2.0))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/anomaly/detect/error-rate")
                        .param("bucket_minutes", "5")
                        .param("sensitivity", "2.0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void reportCarriesBreakdowns() throws Exception {
        when(anomalyQueryService.report(any(), any(), any(), any())).thenReturn(AnomalyReportDto.builder()
                .periodStart(DETECTED_AT.minusSeconds(3600))
                .periodEnd(DETECTED_AT)
                .totalAnomalies(1)
                .anomalies(List.of(spike()))
                .anomaliesBySeverity(Map.of("high", 1L))
                .anomaliesByService(Map.of("payment-service", 1L))
                .build());

        mockMvc.perform(get("/api/v1/anomaly/report"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_anomalies").value(1))
                .andExpect(jsonPath("$.anomalies_by_severity.high").value(1))
                .andExpect(jsonPath("$.anomalies_by_service['payment-service']").value(1))
                .andExpect(jsonPath("$.anomalies[0].detector").value("statistical"));
    }

    @Test
    void invalidConfigurationIsBadRequest() throws Exception {
        when(anomalyQueryService.report(any(), eq(5), any(), any()))
                .thenThrow(new InvalidDetectionConfigException("window_minutes", "must be in [10, 1440], got 5"));

        mockMvc.perform(get("/api/v1/anomaly/report").param("window_minutes", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_configuration"))
                .andExpect(jsonPath("$.field").value("window_minutes"));
    }

    @Test
    void upstreamFailureIsBadGateway() throws Exception {
        when(anomalyQueryService.detect(any(), any(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("statement timeout"));

        mockMvc.perform(get("/api/v1/anomaly/detect/log-volume"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("upstream_fetch_failure"));
    }
}
