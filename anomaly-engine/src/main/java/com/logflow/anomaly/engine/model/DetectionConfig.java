package com.logflow.anomaly.engine.model;

import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Detector tuning for a single request. Passed explicitly to every detector call so that
 * concurrent requests with different sensitivities never share state.
 */
@Value
@Builder(toBuilder = true)
public class DetectionConfig {

    static final double MAX_THRESHOLD = 10.0;
    static final double MAX_CONTAMINATION = 0.5;

    @Builder.Default
    double statisticalThreshold = 1.0;
    @Builder.Default
    int statisticalMinSamples = 5;
    @Builder.Default
    BaselineMode baselineMode = BaselineMode.LEAVE_ONE_OUT;

    @Builder.Default
    int trendWindowSize = 5;
    @Builder.Default
    double trendThresholdMultiplier = 2.0;

    /** Stand-in deviation when the baseline window has none. */
    @Builder.Default
    double minDeviationFloor = 1.0;

    @Builder.Default
    double patternContamination = 0.1;
    @Builder.Default
    int patternMinSamples = 10;
    @Builder.Default
    int patternTrees = 100;
    @Builder.Default
    long patternSeed = 42L;

    public static DetectionConfig defaults() {
        return DetectionConfig.builder().build();
    }

    public void validate() {
        requireThreshold("statisticalThreshold", statisticalThreshold);
        requireThreshold("trendThresholdMultiplier", trendThresholdMultiplier);
        if (statisticalMinSamples < 2) {
            throw new InvalidDetectionConfigException("statisticalMinSamples", "must be at least 2, got " + statisticalMinSamples);
        }
        if (baselineMode == null) {
            throw new InvalidDetectionConfigException("baselineMode", "must be set");
        }
        if (trendWindowSize < 2) {
            throw new InvalidDetectionConfigException("trendWindowSize", "must be at least 2, got " + trendWindowSize);
        }
        if (!(minDeviationFloor > 0)) {
            throw new InvalidDetectionConfigException("minDeviationFloor", "must be positive, got " + minDeviationFloor);
        }
        if (!(patternContamination > 0 && patternContamination <= MAX_CONTAMINATION)) {
            throw new InvalidDetectionConfigException("patternContamination",
                    "must be in (0, " + MAX_CONTAMINATION + "], got " + patternContamination);
        }
        if (patternMinSamples < 2) {
            throw new InvalidDetectionConfigException("patternMinSamples", "must be at least 2, got " + patternMinSamples);
        }
        if (patternTrees < 1) {
            throw new InvalidDetectionConfigException("patternTrees", "must be at least 1, got " + patternTrees);
        }
    }

    private static void requireThreshold(String field, double value) {
        // NaN fails both comparisons
        if (!(value > 0 && value <= MAX_THRESHOLD)) {
            throw new InvalidDetectionConfigException(field, "must be in (0, " + MAX_THRESHOLD + "], got " + value);
        }
    }
}
