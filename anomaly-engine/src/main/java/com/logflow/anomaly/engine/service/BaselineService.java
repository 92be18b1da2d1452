package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.detector.SeriesStatistics;
import com.logflow.anomaly.engine.exception.InvalidDetectionConfigException;
import com.logflow.anomaly.engine.model.BaselineStats;
import com.logflow.anomaly.engine.model.DetectionRequest;
import com.logflow.anomaly.engine.model.MetricSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smile.math.MathEx;

import java.time.Clock;

/**
 * Summary statistics of a metric over a window, used to tune thresholds by hand.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineService {

    private final TimeSeriesSource timeSeriesSource;
    private final Clock clock;

    public BaselineStats calculateBaseline(DetectionRequest request) {
        request.validate();
        if (request.getMetricNames().size() != 1) {
            throw new InvalidDetectionConfigException("metricNames", "baseline takes exactly one metric");
        }
        MetricSeries series = timeSeriesSource.fetchSeries(request.getMetricNames().get(0), request.getService(),
                request.getWindowMinutes(), request.getBucketMinutes());
        return calculateBaseline(series);
    }

    public BaselineStats calculateBaseline(MetricSeries series) {
        BaselineStats.BaselineStatsBuilder baseline = BaselineStats.builder()
                .metricName(series.getMetricName())
                .service(series.getService())
                .sampleCount(series.size())
                .computedAt(clock.instant());
        if (series.size() == 0) {
            return baseline.build();
        }

        double[] values = series.values();
        BaselineStats stats = baseline
                .mean(MathEx.mean(values))
                .stdDev(SeriesStatistics.std(values, 0, values.length))
                .minValue(MathEx.min(values))
                .maxValue(MathEx.max(values))
                .build();
        log.info("Baseline for {} (service={}): mean={}, std={}, samples={}",
                stats.getMetricName(), stats.getService(), stats.getMean(), stats.getStdDev(), stats.getSampleCount());
        return stats;
    }
}
