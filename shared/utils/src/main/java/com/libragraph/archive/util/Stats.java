package com.libragraph.archive.util;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Small numeric helpers over sample arrays read from index maps.
 */
public final class Stats {

    private Stats() {}

    /** Differences between consecutive samples; length is {@code values.length - 1}. */
    public static double[] deltas(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] d = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            d[i - 1] = values[i] - values[i - 1];
        }
        return d;
    }

    /**
     * Median of {@code values}; the mean of the two middle values for even counts.
     * Empty input has no median.
     */
    public static OptionalDouble median(double[] values) {
        if (values.length == 0) {
            return OptionalDouble.empty();
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return OptionalDouble.of(sorted[mid]);
        }
        return OptionalDouble.of((sorted[mid - 1] + sorted[mid]) / 2.0);
    }

    public static double min(double[] values) {
        requireNonEmpty(values);
        double m = values[0];
        for (double v : values) {
            if (v < m) m = v;
        }
        return m;
    }

    public static double max(double[] values) {
        requireNonEmpty(values);
        double m = values[0];
        for (double v : values) {
            if (v > m) m = v;
        }
        return m;
    }

    private static void requireNonEmpty(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No samples");
        }
    }
}
