package com.logflow.anomaly.engine.detector;

import com.logflow.anomaly.engine.model.Anomaly;
import com.logflow.anomaly.engine.model.AnomalyType;
import com.logflow.anomaly.engine.model.DetectionConfig;
import com.logflow.anomaly.engine.model.DetectorKind;
import com.logflow.anomaly.engine.model.MetricSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Isolation forest over the bucket values taken as one-feature samples. The forest is fit and
 * scored within a single call; nothing is kept between requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternDetector implements AnomalyDetector {

    private static final int SUBSAMPLE = 256;
    private static final double MAX_SAMPLING_RATE = 0.7;

    /** Forest score breakpoints and the z-equivalent score each maps to. */
    private static final double[] FOREST_SCORES = {0.0, 0.4, 0.5, 0.6, 1.0};
    private static final double[] Z_EQUIVALENTS = {0.0, 2.5, 3.0, 4.0, 6.0};

    private final AnomalyFactory anomalyFactory;

    @Override
    public DetectorKind kind() {
        return DetectorKind.PATTERN;
    }

    @Override
    public List<Anomaly> detect(MetricSeries series, DetectionConfig config) {
        int n = series.size();
        if (n < config.getPatternMinSamples()) {
            log.debug("Not enough samples for isolation forest on {}: {} < {}", series.getMetricName(), n, config.getPatternMinSamples());
            return List.of();
        }

        double[] values = series.values();
        if (Arrays.stream(values).distinct().count() < 2) {
            return List.of();
        }

        double[] scores = score(values, config.getPatternTrees(), config.getPatternSeed());
        double cutoff = percentile(scores, 1.0 - config.getPatternContamination());

        boolean[] flagged = new boolean[n];
        double normalSum = 0;
        int normalCount = 0;
        for (int i = 0; i < n; i++) {
            flagged[i] = scores[i] > cutoff;
            if (!flagged[i]) {
                normalSum += values[i];
                normalCount++;
            }
        }
        double expected = normalSum / normalCount;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (flagged[i]) {
                anomalies.add(anomalyFactory.create(series, i, AnomalyType.PATTERN_CHANGE, zEquivalent(scores[i]), expected, kind()));
            }
        }
        log.info("Isolation Forest found {} anomalies in {} (cutoff={})", anomalies.size(), series.getMetricName(), cutoff);
        return anomalies;
    }

    /**
     * Anomaly score per value, in (0, 1], higher meaning easier to isolate.
     */
    private static double[] score(double[] values, int trees, long seed) {
        double[][] samples = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            samples[i] = new double[]{values[i]};
        }

        // sampling_rate = min(0.7, TARGET_SUBSAMPLE / n), must stay below 1
        double samplingRate = Math.min(MAX_SAMPLING_RATE, SUBSAMPLE / (double) samples.length);
        int sampleSize = Math.max(2, (int) Math.round(samplingRate * samples.length));
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(sampleSize) / Math.log(2)));
        IsolationForest forest = fitSeeded(samples, trees, maxDepth, samplingRate, seed);

        double[] scores = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            scores[i] = forest.score(samples[i]);
        }
        return scores;
    }

    /**
     * Fits on a private one-thread pool. Smile draws from a per-thread generator and builds the
     * trees on a parallel stream, which then runs entirely on the freshly seeded worker.
     */
    private static IsolationForest fitSeeded(double[][] samples, int trees, int maxDepth,
                                             double samplingRate, long seed) {
        ForkJoinPool pool = new ForkJoinPool(1, ForkJoinPool.defaultForkJoinWorkerThreadFactory, null, false,
                1, 1, 1, saturated -> true, 30, TimeUnit.SECONDS);
        try {
            return pool.submit(() -> {
                MathEx.setSeed(seed);
                return IsolationForest.fit(samples, trees, maxDepth, samplingRate, 0);
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fitting isolation forest", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Isolation forest fit failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    /**
     * Maps a forest score onto the z-score scale the severity tiers use: 0.4, 0.5 and 0.6
     * land on 2.5, 3.0 and 4.0, linear in between.
     */
    static double zEquivalent(double forestScore) {
        double score = Math.max(0.0, Math.min(1.0, forestScore));
        for (int i = 1; i < FOREST_SCORES.length; i++) {
            if (score <= FOREST_SCORES[i]) {
                double fraction = (score - FOREST_SCORES[i - 1]) / (FOREST_SCORES[i] - FOREST_SCORES[i - 1]);
                return Z_EQUIVALENTS[i - 1] + fraction * (Z_EQUIVALENTS[i] - Z_EQUIVALENTS[i - 1]);
            }
        }
        return Z_EQUIVALENTS[Z_EQUIVALENTS.length - 1];
    }

    /** Linear interpolation between closest ranks. */
    static double percentile(double[] scores, double quantile) {
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        double rank = quantile * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
