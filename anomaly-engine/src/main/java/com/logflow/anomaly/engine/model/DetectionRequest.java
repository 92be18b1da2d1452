package com.logflow.anomaly.engine.model;

import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class DetectionRequest {

    static final int MAX_WINDOW_MINUTES = 7 * 24 * 60;

    @Singular
    List<String> metricNames;
    String service;
    @Builder.Default
    int windowMinutes = 60;
    @Builder.Default
    int bucketMinutes = 1;
    @Builder.Default
    DetectionConfig config = DetectionConfig.defaults();

    public Duration bucketSize() {
        return Duration.ofMinutes(bucketMinutes);
    }

    public Duration window() {
        return Duration.ofMinutes(windowMinutes);
    }

    /**
     * Fails fast on anything that would make the whole request meaningless.
     *
     * @throws InvalidDetectionConfigException on the first offending field
     */
    public void validate() {
        if (windowMinutes <= 0 || windowMinutes > MAX_WINDOW_MINUTES) {
            throw new InvalidDetectionConfigException("windowMinutes",
                    "must be in [1, " + MAX_WINDOW_MINUTES + "], got " + windowMinutes);
        }
        if (bucketMinutes <= 0 || bucketMinutes > windowMinutes) {
            throw new InvalidDetectionConfigException("bucketMinutes",
                    "must be in [1, windowMinutes], got " + bucketMinutes);
        }
        if (metricNames.isEmpty()) {
            throw new InvalidDetectionConfigException("metricNames", "at least one metric is required");
        }
        for (String metricName : metricNames) {
            if (!Metrics.isSupported(metricName)) {
                throw new InvalidDetectionConfigException("metricNames", "unsupported metric " + metricName);
            }
        }
        if (service != null && service.isBlank()) {
            throw new InvalidDetectionConfigException("service", "must not be blank");
        }
        if (config == null) {
            throw new InvalidDetectionConfigException("config", "must be set");
        }
        config.validate();
    }
}
