package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.model.Severity;
import org.springframework.stereotype.Service;

/**
 * Maps a detector score and a deviation percentage to a severity tier. The result is the
 * higher of the two tiers the criteria point at.
 */
@Service
public class SeverityClassifier {

    private static final double CRITICAL_SCORE = 4.0;
    private static final double HIGH_SCORE = 3.0;
    private static final double MEDIUM_SCORE = 2.5;

    private static final double CRITICAL_DEVIATION = 400.0;
    private static final double HIGH_DEVIATION = 300.0;
    private static final double MEDIUM_DEVIATION = 250.0;

    public Severity classify(double score, double deviationPercent) {
        Severity byScore = byScore(Double.isNaN(score) ? 0 : Math.abs(score));
        Severity byDeviation = byDeviation(Double.isNaN(deviationPercent) ? 0 : Math.abs(deviationPercent));
        return byDeviation.isHigherThan(byScore) ? byDeviation : byScore;
    }

    private static Severity byScore(double score) {
        if (score > CRITICAL_SCORE) return Severity.CRITICAL;
        if (score > HIGH_SCORE) return Severity.HIGH;
        if (score > MEDIUM_SCORE) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private static Severity byDeviation(double deviation) {
        if (deviation > CRITICAL_DEVIATION) return Severity.CRITICAL;
        if (deviation > HIGH_DEVIATION) return Severity.HIGH;
        if (deviation > MEDIUM_DEVIATION) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
