package com.spectralsentinel.core.math;

import java.util.Objects;

/**
 * Trailing moving average with a warm-up prefix.
 *
 * <ul>
 * <li>{@code out[i] = mean(values[i-w+1 .. i])} for {@code i >= w}</li>
 * <li>{@code out[i] = mean(values[0 .. i])} for {@code i < w}</li>
 * </ul>
 * where {@code w = min(window, values.length)}. Computed from running sums.
 *
 * @since 1.0.0
 */
public class TrailingAverageFilter implements MovingAverageFilter {

    @Override
    public double[] apply(double[] values, int window) {
        Objects.requireNonNull(values, "values must not be null");
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got: " + window);
        }
        int n = values.length;
        if (n == 0) {
            return new double[0];
        }
        int w = Math.min(window, n);

        double[] cumulative = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            cumulative[i] = sum;
        }

        double[] result = new double[n];
        result[0] = cumulative[0];
        for (int i = 1; i < w; i++) {
            result[i] = cumulative[i] / (i + 1);
        }
        for (int i = w; i < n; i++) {
            result[i] = (cumulative[i] - cumulative[i - w]) / w;
        }
        return result;
    }
}
