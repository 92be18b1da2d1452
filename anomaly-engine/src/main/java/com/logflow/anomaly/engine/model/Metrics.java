package com.logflow.anomaly.engine.model;

import java.util.List;

public final class Metrics {

    public static final String LOG_VOLUME = "log_volume";
    public static final String ERROR_RATE = "error_rate";

    public static final List<String> SUPPORTED = List.of(LOG_VOLUME, ERROR_RATE);

    private Metrics() {
    }

    public static boolean isSupported(String metricName) {
        return SUPPORTED.contains(metricName);
    }
}
