package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.detector.AnomalyDetector;
import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.MetricSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs every detector against one series in parallel and merges what they found.
 */
@Slf4j
@Service
public class AnomalyDetectionService {

    private final List<AnomalyDetector> detectors;
    private final AnomalyMerger anomalyMerger;
    private final Executor executor;

    public AnomalyDetectionService(List<AnomalyDetector> detectors,
                                   AnomalyMerger anomalyMerger,
                                   @Qualifier("detectorExecutor") Executor executor) {
        this.detectors = new ArrayList<>(detectors);
        this.detectors.sort(Comparator.comparing(AnomalyDetector::kind));
        this.anomalyMerger = anomalyMerger;
        this.executor = executor;
    }

    public List<Anomaly> detect(MetricSeries series, DetectionConfig config) {
        log.info("Detecting anomalies in {} (service={}, buckets={})",
                series.getMetricName(), series.getService(), series.size());

        List<CompletableFuture<List<Anomaly>>> futures = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            futures.add(CompletableFuture.supplyAsync(() -> detector.detect(series, config), executor));
        }

        List<Anomaly> detections = new ArrayList<>();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<List<Anomaly>> future : futures) {
                detections.addAll(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        List<Anomaly> merged = anomalyMerger.merge(detections, series.getBucketSize());
        log.info("Total unique anomalies in {}: {} (from {} detections)", series.getMetricName(), merged.size(), detections.size());
        return merged;
    }
}
