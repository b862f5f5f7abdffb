package com.spectralsentinel.core.math;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Interpolates each anomalous point from a straight line fitted to nearby
 * clean points.
 *
 * <p>
 * For an anomaly at index {@code idx} the search window starts at
 * {@code [idx - 1, idx + 1]} and doubles its half-width until it holds at least
 * {@value #MIN_POINTS_TO_FIT} non-anomalous points or spans the whole series.
 * A least-squares line through those points (value against index) is then
 * evaluated at {@code idx}. Fits always use the original values, never
 * previously interpolated ones.
 * </p>
 *
 * @since 1.0.0
 */
public class LeastSquaresInterpolator implements AnomalyInterpolator {

    private static final Logger LOG = LoggerFactory.getLogger(LeastSquaresInterpolator.class);

    /** Clean points wanted before fitting. */
    static final int MIN_POINTS_TO_FIT = 4;

    @Override
    public double[] removeAnomalies(double[] values, int[] anomalyIndices) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(anomalyIndices, "anomalyIndices must not be null");

        int n = values.length;
        boolean[] anomalous = new boolean[n];
        for (int idx : anomalyIndices) {
            Objects.checkIndex(idx, n);
            anomalous[idx] = true;
        }

        double[] result = values.clone();
        for (int idx : anomalyIndices) {
            result[idx] = estimate(values, anomalous, idx);
        }
        return result;
    }

    private double estimate(double[] values, boolean[] anomalous, int idx) {
        int n = values.length;
        int step = 1;
        SimpleRegression regression;
        double lastClean;
        while (true) {
            int start = Math.max(idx - step, 0);
            int end = Math.min(n - 1, idx + step);

            regression = new SimpleRegression();
            lastClean = Double.NaN;
            for (int i = start; i <= end; i++) {
                if (!anomalous[i]) {
                    regression.addData(i, values[i]);
                    lastClean = values[i];
                }
            }
            boolean coversSeries = start == 0 && end == n - 1;
            if (regression.getN() >= MIN_POINTS_TO_FIT || coversSeries) {
                break;
            }
            step *= 2;
        }

        long count = regression.getN();
        if (count >= 2) {
            return regression.predict(idx);
        }
        if (count == 1) {
            return lastClean;
        }
        LOG.warn("No clean points to interpolate index {} from; keeping the original value", idx);
        return values[idx];
    }
}
