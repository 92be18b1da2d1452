package com.logflow.anomaly.engine.service;

import com.logflow.anomaly.engine.model.Anomaly;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses detections of the same event by different detectors into one anomaly per
 * (metric, service, bucket).
 */
@Slf4j
@Service
public class AnomalyMerger {

    /**
     * Which anomaly survives within a group: highest severity, then highest score, then the
     * detector declared first, then the earliest timestamp.
     */
    static final Comparator<Anomaly> PREFERENCE = Comparator
            .comparing(Anomaly::getSeverity)
            .thenComparingDouble(Anomaly::getScore)
            .thenComparing(Anomaly::getDetector, Comparator.reverseOrder())
            .thenComparing(Anomaly::getDetectedAt, Comparator.reverseOrder());

    /**
     * Report order: severity descending, absolute score descending, then timestamp, metric,
     * service and detector ascending so equal-ranked anomalies always come out the same way.
     */
    public static final Comparator<Anomaly> RANKING = Comparator
            .comparing(Anomaly::getSeverity, Comparator.reverseOrder())
            .thenComparing(anomaly -> Math.abs(anomaly.getScore()), Comparator.reverseOrder())
            .thenComparing(Anomaly::getDetectedAt)
            .thenComparing(Anomaly::getMetricName)
            .thenComparing(Anomaly::getService, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Anomaly::getDetector);

    public List<Anomaly> merge(List<Anomaly> anomalies, Duration bucketSize) {
        if (anomalies.isEmpty()) {
            return List.of();
        }

        Map<GroupKey, Anomaly> best = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            GroupKey key = new GroupKey(anomaly.getMetricName(), anomaly.getService(),
                    floorToBucket(anomaly.getDetectedAt(), bucketSize));
            best.merge(key, anomaly, (current, candidate) ->
                    PREFERENCE.compare(candidate, current) > 0 ? candidate : current);
        }

        List<Anomaly> merged = new ArrayList<>(best.values());
        merged.sort(RANKING);
        log.debug("Merged {} detections into {} anomalies", anomalies.size(), merged.size());
        return merged;
    }

    static Instant floorToBucket(Instant timestamp, Duration bucketSize) {
        long bucketSeconds = Math.max(1, bucketSize.getSeconds());
        long epochSecond = timestamp.getEpochSecond();
        return Instant.ofEpochSecond(epochSecond - Math.floorMod(epochSecond, bucketSeconds));
    }

    @Value
    private static class GroupKey {
        String metricName;
        String service;
        Instant bucket;
    }
}
