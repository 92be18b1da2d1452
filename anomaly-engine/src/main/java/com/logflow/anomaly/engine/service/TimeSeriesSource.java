package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.model.MetricSeries;

/**
 * Boundary to the store that aggregates log events into bucket counts. Implementations must
 * return buckets in ascending order, evenly spaced, with missing intervals filled with zero.
 * Failures propagate to the caller; the engine does not retry.
 */
public interface TimeSeriesSource {

    MetricSeries fetchSeries(String metricName, String service, int windowMinutes, int bucketMinutes);
}
