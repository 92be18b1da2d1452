package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.MetricSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares every bucket against the mean and deviation of the buckets trailing it. Catches
 * sustained drift the global z-score misses once the global mean has moved with it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TrendDetector implements AnomalyDetector {

    private final AnomalyFactory anomalyFactory;

    @Override
    public DetectorKind kind() {
        return DetectorKind.TREND;
    }

    @Override
    public List<Anomaly> detect(MetricSeries series, DetectionConfig config) {
        int window = config.getTrendWindowSize();
        int n = series.size();
        if (n <= window) {
            log.debug("Not enough samples for moving average on {}: {} <= {}", series.getMetricName(), n, window);
            return List.of();
        }

        double[] values = series.values();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = window; i < n; i++) {
            double localMean = SeriesStatistics.mean(values, i - window, i);
            double localStd = SeriesStatistics.std(values, i - window, i);
            // a perfectly flat trailing window would otherwise flag any change at all
            double effectiveStd = SeriesStatistics.isDegenerate(localStd, localMean) ? config.getMinDeviationFloor() : localStd;

            double distance = Math.abs(values[i] - localMean);
            if (distance > config.getTrendThresholdMultiplier() * effectiveStd) {
                AnomalyType type = values[i] > localMean ? AnomalyType.SPIKE : AnomalyType.DROP;
                anomalies.add(anomalyFactory.create(series, i, type, distance / effectiveStd, localMean, kind()));
            }
        }
        log.info("Moving Average found {} anomalies in {} (window={})", anomalies.size(), series.getMetricName(), window);
        return anomalies;
    }
}
