package com.logflow.anomaly.engine.detector;

/**
 * Population statistics over a half-open index range of a value array.
 */
public final class SeriesStatistics {

    private static final double RELATIVE_EPSILON = 1e-9;

    private SeriesStatistics() {
    }

    /** Treats a deviation lost in rounding noise of a constant series as no deviation at all. */
    public static boolean isDegenerate(double std, double mean) {
        return std <= RELATIVE_EPSILON * Math.max(1.0, Math.abs(mean));
    }

    public static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double std(double[] values, int from, int to) {
        double mean = mean(values, from, to);
        double squares = 0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (to - from));
    }

    public static double meanExcluding(double[] values, int excluded) {
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            if (i != excluded) {
                sum += values[i];
            }
        }
        return sum / (values.length - 1);
    }

    public static double stdExcluding(double[] values, int excluded) {
        double mean = meanExcluding(values, excluded);
        double squares = 0;
        for (int i = 0; i < values.length; i++) {
            if (i != excluded) {
                double d = values[i] - mean;
                squares += d * d;
            }
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
