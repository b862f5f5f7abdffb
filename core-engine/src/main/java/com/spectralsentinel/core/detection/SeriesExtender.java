package com.spectralsentinel.core.detection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Extrapolates a short flat tail onto a series before it is Fourier
 * transformed.
 *
 * <p>
 * The discrete Fourier transform treats its input as periodic, so a jump
 * between the last and the first value shows up as spurious saliency at the
 * end of the series. Appending a few copies of a predicted next value moves
 * that discontinuity past the points that are actually scored; the tail is
 * dropped again after the transform.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesExtender {

    /** Default number of predicted values appended to the series. */
    public static final int DEFAULT_EXTEND_NUM = 5;

    /** Default number of preceding values the prediction looks at. */
    public static final int DEFAULT_LOOK_AHEAD = 5;

    private SeriesExtender() {
        // utility class, not instantiable
    }

    /**
     * Predict the value following {@code values}.
     *
     * <p>
     * With {@code n} values and {@code last = values[n-1]}, every earlier point
     * contributes the slope {@code (last - values[i]) / (n - 1 - i)}; the result
     * is {@code values[1]} plus the sum of those slopes.
     * </p>
     *
     * @param values the history; at least two values
     * @return the predicted next value
     * @throws IllegalArgumentException if fewer than two values are given
     */
    public static double predictNext(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length < 2) {
            throw new IllegalArgumentException(
                    "Prediction needs at least 2 values, got: " + values.length);
        }
        int n = values.length;
        double last = values[n - 1];
        double slopeSum = 0.0;
        for (int i = 0; i < n - 1; i++) {
            slopeSum += (last - values[i]) / (n - 1 - i);
        }
        return values[1] + slopeSum;
    }

    /**
     * Extend with the default tail length and look-ahead.
     *
     * @see #extendSeries(double[], int, int)
     */
    public static double[] extendSeries(double[] values) {
        return extendSeries(values, DEFAULT_EXTEND_NUM, DEFAULT_LOOK_AHEAD);
    }

    /**
     * Append {@code extendNum} copies of one predicted value.
     *
     * <p>
     * The prediction uses the last {@code lookAhead + 2} values excluding the
     * final one, i.e. {@code values[n - lookAhead - 2 .. n - 2]} clipped at the
     * start of the array. The first {@code values.length} elements of the
     * result equal the input.
     * </p>
     *
     * @param values    the series; at least three values
     * @param extendNum number of values to append; {@code >= 0}
     * @param lookAhead how far back the prediction looks; {@code >= 1}
     * @return a new array of length {@code values.length + extendNum}
     * @throws IllegalArgumentException if {@code lookAhead < 1},
     *                                  {@code extendNum < 0}, or the series is
     *                                  too short to predict from
     */
    public static double[] extendSeries(double[] values, int extendNum, int lookAhead) {
        Objects.requireNonNull(values, "values must not be null");
        if (lookAhead < 1) {
            throw new IllegalArgumentException("lookAhead must be at least 1, got: " + lookAhead);
        }
        if (extendNum < 0) {
            throw new IllegalArgumentException("extendNum must be >= 0, got: " + extendNum);
        }

        int n = values.length;
        int from = Math.max(0, n - lookAhead - 2);
        int to = Math.max(from, n - 1);
        double next = predictNext(Arrays.copyOfRange(values, from, to));

        double[] extended = Arrays.copyOf(values, n + extendNum);
        Arrays.fill(extended, n, extended.length, next);
        return extended;
    }
}
