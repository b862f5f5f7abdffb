package com.spectralsentinel.core.math;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Objects;

/**
 * Centered running median with shrinking windows at both ends.
 *
 * <p>
 * The requested window is widened to the odd width
 * {@code w = (window / 2) * 2 + 1}. Position {@code i} receives the median of
 * {@code values[max(0, i - w/2) .. min(n - 1, i + w/2)]}; near the edges the
 * window is truncated rather than padded. The median of an even-sized window
 * is the mean of its two middle values. If the series is shorter than
 * {@code w} the result is all zeros.
 * </p>
 *
 * @since 1.0.0
 */
public final class MedianFilter {

    private MedianFilter() {
        // utility class, not instantiable
    }

    /**
     * @param values input values; must not be {@code null}
     * @param window requested window; must be {@code >= 0}
     * @return filtered values, same length as {@code values}
     * @throws IllegalArgumentException if {@code window} is negative
     */
    public static double[] apply(double[] values, int window) {
        Objects.requireNonNull(values, "values must not be null");
        if (window < 0) {
            throw new IllegalArgumentException("window must be >= 0, got: " + window);
        }
        int n = values.length;
        int half = window / 2;
        int width = half * 2 + 1;
        double[] result = new double[n];
        if (n < width) {
            return result;
        }

        Median median = new Median();
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n - 1, i + half);
            result[i] = median.evaluate(values, from, to - from + 1);
        }
        return result;
    }
}
