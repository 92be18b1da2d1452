package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.MetricSeries;
import com.logflow.anomaly.engine.model.TimeBucket;
import com.logflow.anomaly.engine.service.SeverityClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Builds {@link Anomaly} values for the detectors: deviation percentage, severity and description.
 */
@Component
@RequiredArgsConstructor
public class AnomalyFactory {

    /** Reported instead of an infinite deviation when the expectation is zero. */
    public static final double DEVIATION_SENTINEL = 10_000.0;

    private final SeverityClassifier severityClassifier;

    public Anomaly create(MetricSeries series, int index, AnomalyType type, double score,
                          double expectedValue, DetectorKind detector) {
        TimeBucket bucket = series.getBuckets().get(index);
        double actualValue = bucket.getValue();
        double deviationPercent = deviationPercent(actualValue, expectedValue);

        return Anomaly.builder()
                .detectedAt(bucket.getTimestamp())
                .metricName(series.getMetricName())
                .service(series.getService())
                .anomalyType(type)
                .description(String.format(Locale.ROOT, "%s %s (%s): %.2f (expected ~%.2f)",
                        series.getMetricName(), type.value(), detector.label(), actualValue, expectedValue))
                .score(score)
                .severity(severityClassifier.classify(score, deviationPercent))
                .actualValue(actualValue)
                .expectedValue(expectedValue)
                .deviationPercent(deviationPercent)
                .detector(detector)
                .build();
    }

    public static double deviationPercent(double actualValue, double expectedValue) {
        double difference = actualValue - expectedValue;
        if (expectedValue == 0) {
            return difference == 0 ? 0 : Math.copySign(DEVIATION_SENTINEL, difference);
        }
        return difference / Math.abs(expectedValue) * 100;
    }
}
