package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyReport;
import com.logflow.anomaly.engine.model.DetectionRequest;
import com.logflow.anomaly.engine.model.MetricSeries;
import com.logflow.anomaly.engine.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyReportBuilder {

    private final TimeSeriesSource timeSeriesSource;
    private final AnomalyDetectionService anomalyDetectionService;
    private final Clock clock;

    /**
     * Fetches every requested metric, runs the detectors on it and returns the merged anomalies
     * in report order.
     *
     * @throws com.logflow.anomaly.engine.exception.InvalidDetectionConfigException before any
     *         fetch when the request is invalid
     */
    public List<Anomaly> detect(DetectionRequest request) {
        request.validate();

        List<Anomaly> anomalies = new ArrayList<>();
        for (String metricName : request.getMetricNames()) {
            MetricSeries series = timeSeriesSource.fetchSeries(metricName, request.getService(),
                    request.getWindowMinutes(), request.getBucketMinutes());
            log.info("Got {} time series points of {} for anomaly detection", series.size(), metricName);
            anomalies.addAll(anomalyDetectionService.detect(series, request.getConfig()));
        }
        anomalies.sort(AnomalyMerger.RANKING);
        return anomalies;
    }

    public AnomalyReport build(DetectionRequest request) {
        Instant periodEnd = clock.instant();
        Instant periodStart = periodEnd.minus(request.window());

        List<Anomaly> anomalies = detect(request);
        AnomalyReport report = assemble(periodStart, periodEnd, anomalies);
        log.info("Anomaly report for [{} - {}]: {} anomalies, by severity {}",
                periodStart, periodEnd, report.getTotalAnomalies(), report.getAnomaliesBySeverity());
        return report;
    }

    AnomalyReport assemble(Instant periodStart, Instant periodEnd, List<Anomaly> anomalies) {
        List<Anomaly> ordered = new ArrayList<>(anomalies);
        ordered.sort(AnomalyMerger.RANKING);

        // highest tier first, only tiers that occur
        Map<Severity, Long> severityCounts = new TreeMap<>((a, b) -> b.compareTo(a));
        Map<String, Long> byService = new TreeMap<>();
        for (Anomaly anomaly : ordered) {
            severityCounts.merge(anomaly.getSeverity(), 1L, Long::sum);
            String service = anomaly.getService() == null ? AnomalyReport.ALL_SERVICES : anomaly.getService();
            byService.merge(service, 1L, Long::sum);
        }
        Map<String, Long> bySeverity = new LinkedHashMap<>();
        severityCounts.forEach((severity, count) -> bySeverity.put(severity.value(), count));

        return AnomalyReport.builder()
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .anomalies(List.copyOf(ordered))
                .totalAnomalies(ordered.size())
                .anomaliesBySeverity(bySeverity)
                .anomaliesByService(byService)
                .build();
    }
}
