package com.logflow.anomaly.services;

import com.logflow.anomaly.engine.model.BaselineMode;
import com.logflow.anomaly.engine.model.DetectionConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Detector defaults from {@code anomaly.detection.*}. Every request gets its own
 * {@link DetectionConfig} built from these, with the caller's overrides applied.
 */
@Service
@RequiredArgsConstructor
public class DetectionSettingsService {

    @Value("${anomaly.detection.statistical-threshold:1.0}")
    private double statisticalThreshold;

    @Value("${anomaly.detection.statistical-min-samples:5}")
    private int statisticalMinSamples;

    @Value("${anomaly.detection.baseline-mode:LEAVE_ONE_OUT}")
    private BaselineMode baselineMode;

    @Value("${anomaly.detection.trend-window-size:5}")
    private int trendWindowSize;

    @Value("${anomaly.detection.trend-threshold-multiplier:2.0}")
    private double trendThresholdMultiplier;

    @Value("${anomaly.detection.min-deviation-floor:1.0}")
    private double minDeviationFloor;

    @Value("${anomaly.detection.pattern-contamination:0.1}")
    private double patternContamination;

    @Value("${anomaly.detection.pattern-min-samples:10}")
    private int patternMinSamples;

    @Value("${anomaly.detection.pattern-trees:100}")
    private int patternTrees;

    @Value("${anomaly.detection.pattern-seed:42}")
    private long patternSeed;

    @Value("${anomaly.detection.window-minutes:60}")
    private int windowMinutes;

    @Value("${anomaly.detection.bucket-minutes:1}")
    private int bucketMinutes;

    public DetectionConfig config(Double sensitivity) {
        return DetectionConfig.builder()
                .statisticalThreshold(sensitivity != null ? sensitivity : statisticalThreshold)
                .statisticalMinSamples(statisticalMinSamples)
                .baselineMode(baselineMode)
                .trendWindowSize(trendWindowSize)
                .trendThresholdMultiplier(trendThresholdMultiplier)
                .minDeviationFloor(minDeviationFloor)
                .patternContamination(patternContamination)
                .patternMinSamples(patternMinSamples)
                .patternTrees(patternTrees)
                .patternSeed(patternSeed)
                .build();
    }

    public int windowMinutes() {
        return windowMinutes;
    }

    public int bucketMinutes() {
        return bucketMinutes;
    }
}
