package com.logflow.anomaly.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Ordered (ascending) bucket series of one metric, optionally scoped to a single service.
 * Gaps are expected to be zero-filled by whoever produced the series.
 */
@Value
@Builder
public class MetricSeries {

    String metricName;
    String service;                    // null = aggregate across all services
    @Builder.Default
    Duration bucketSize = Duration.ofMinutes(1);
    @Singular
    List<TimeBucket> buckets;

    public int size() {
        return buckets.size();
    }

    public double[] values() {
        double[] values = new double[buckets.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = buckets.get(i).getValue();
        }
        return values;
    }

    public static MetricSeries empty(String metricName, String service, Duration bucketSize) {
        return MetricSeries.builder().metricName(metricName).service(service).bucketSize(bucketSize).build();
    }
}
