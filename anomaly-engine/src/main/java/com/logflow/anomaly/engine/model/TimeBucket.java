package com.logflow.anomaly.engine.model;

import lombok.Value;

import java.time.Instant;

@Value
public class TimeBucket {
    Instant timestamp;
    double value;

    public static TimeBucket of(Instant timestamp, double value) {
        return new TimeBucket(timestamp, value);
    }
}
