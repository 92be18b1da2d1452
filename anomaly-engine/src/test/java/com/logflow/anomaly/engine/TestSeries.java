package com.logflow.anomaly.engine;

import com.logflow.anomaly.engine.detector.AnomalyFactory;
import com.logflow.anomaly.engine.model.MetricSeries;
import com.logflow.anomaly.engine.model.TimeBucket;
import com.logflow.anomaly.engine.service.SeverityClassifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Series fixtures: one bucket per minute starting at {@link #START}.
 */
public final class TestSeries {

    public static final Instant START = Instant.parse("2025-10-24T02:00:00Z");

    private TestSeries() {
    }

    public static MetricSeries of(String metricName, String service, double... values) {
        MetricSeries.MetricSeriesBuilder builder = MetricSeries.builder()
                .metricName(metricName)
                .service(service)
                .bucketSize(Duration.ofMinutes(1));
        for (int i = 0; i < values.length; i++) {
            builder.bucket(TimeBucket.of(at(i), values[i]));
        }
        return builder.build();
    }

    public static MetricSeries of(String metricName, double... values) {
        return of(metricName, null, values);
    }

    public static Instant at(int index) {
        return START.plus(Duration.ofMinutes(index));
    }

    public static double[] repeat(double value, int count) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return values;
    }

    public static double[] concat(double[] first, double[] second) {
        double[] values = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, values, first.length, second.length);
        return values;
    }

    public static AnomalyFactory anomalyFactory() {
        return new AnomalyFactory(new SeverityClassifier());
    }
}
