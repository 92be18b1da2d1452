package com.logflow.anomaly.repositories;

/**
 * One aggregated bucket: start of the bucket in epoch seconds, number of events, number of
 * ERROR/CRITICAL events.
 */
public interface BucketCount {

    Long getBucketEpoch();

    Long getTotal();

    Long getErrors();
}
