package com.logflow.anomaly.services;

import com.logflow.anomaly.engine.model.MetricSeries;
import com.logflow.anomaly.engine.model.Metrics;
import com.logflow.anomaly.engine.model.TimeBucket;
import com.logflow.anomaly.engine.service.TimeSeriesSource;
import com.logflow.anomaly.repositories.BucketCount;
import com.logflow.anomaly.repositories.LogEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates {@code t_log_event} into complete buckets ending at the start of the current one.
 * Buckets without events are filled with zero before the series leaves this class.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogEventTimeSeriesSource implements TimeSeriesSource {

    private final LogEventRepository logEventRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public MetricSeries fetchSeries(String metricName, String service, int windowMinutes, int bucketMinutes) {
        Duration bucketSize = Duration.ofMinutes(bucketMinutes);
        long bucketSeconds = bucketSize.getSeconds();
        int bucketCount = windowMinutes / bucketMinutes;

        long nowEpoch = clock.instant().getEpochSecond();
        Instant end = Instant.ofEpochSecond(nowEpoch - Math.floorMod(nowEpoch, bucketSeconds));
        Instant start = end.minus(bucketSize.multipliedBy(bucketCount));

        List<BucketCount> counts = service == null
                ? logEventRepository.countByBucket(start, end, bucketSeconds)
                : logEventRepository.countByBucketAndService(start, end, bucketSeconds, service);
        log.debug("Fetched {} non-empty buckets of {} for service={} in [{} - {})", counts.size(), metricName, service, start, end);

        return toSeries(metricName, service, bucketSize, start, bucketCount, counts);
    }

    static MetricSeries toSeries(String metricName, String service, Duration bucketSize,
                                 Instant start, int bucketCount, List<BucketCount> counts) {
        Map<Long, BucketCount> byEpoch = new HashMap<>();
        counts.forEach(count -> byEpoch.put(count.getBucketEpoch(), count));

        MetricSeries.MetricSeriesBuilder series = MetricSeries.builder()
                .metricName(metricName)
                .service(service)
                .bucketSize(bucketSize);
        for (int i = 0; i < bucketCount; i++) {
            Instant timestamp = start.plus(bucketSize.multipliedBy(i));
            BucketCount count = byEpoch.get(timestamp.getEpochSecond());
            series.bucket(TimeBucket.of(timestamp, valueOf(metricName, count)));
        }
        return series.build();
    }

    private static double valueOf(String metricName, BucketCount count) {
        if (count == null || count.getTotal() == null || count.getTotal() == 0) {
            return 0.0;
        }
        if (Metrics.ERROR_RATE.equals(metricName)) {
            long errors = count.getErrors() == null ? 0 : count.getErrors();
            return errors * 100.0 / count.getTotal();
        }
        return count.getTotal();
    }
}
