package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.BaselineMode;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.MetricSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Z-score detector against a global baseline of the whole window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatisticalDetector implements AnomalyDetector {

    private final AnomalyFactory anomalyFactory;

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }

    @Override
    public List<Anomaly> detect(MetricSeries series, DetectionConfig config) {
        int n = series.size();
        if (n < config.getStatisticalMinSamples()) {
            log.debug("Not enough samples for z-score on {}: {} < {}", series.getMetricName(), n, config.getStatisticalMinSamples());
            return List.of();
        }

        double[] values = series.values();
        double mean = SeriesStatistics.mean(values, 0, n);
        double std = SeriesStatistics.std(values, 0, n);
        log.debug("Z-Score {}: mean={}, std={}", series.getMetricName(), mean, std);
        if (SeriesStatistics.isDegenerate(std, mean)) {
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double value = values[i];
            double expected = mean;
            double deviation = std;
            if (config.getBaselineMode() == BaselineMode.LEAVE_ONE_OUT) {
                expected = SeriesStatistics.meanExcluding(values, i);
                deviation = SeriesStatistics.stdExcluding(values, i);
                if (SeriesStatistics.isDegenerate(deviation, expected)) {
                    deviation = config.getMinDeviationFloor();
                }
            }

            double z = (value - expected) / deviation;
            if (Math.abs(z) > config.getStatisticalThreshold()) {
                AnomalyType type = value > expected ? AnomalyType.SPIKE : AnomalyType.DROP;
                anomalies.add(anomalyFactory.create(series, i, type, Math.abs(z), expected, kind()));
            }
        }
        log.info("Z-Score found {} anomalies in {} ({} buckets)", anomalies.size(), series.getMetricName(), n);
        return anomalies;
    }
}
