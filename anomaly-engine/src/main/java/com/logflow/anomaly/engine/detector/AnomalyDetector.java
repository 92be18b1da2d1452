package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.MetricSeries;

import java.util.List;

/**
 * One of the three stateless detection strategies run against a metric series.
 * Insufficient or degenerate data yields an empty list, never an exception.
 */
public interface AnomalyDetector {

    DetectorKind kind();

    List<Anomaly> detect(MetricSeries series, DetectionConfig config);
}
