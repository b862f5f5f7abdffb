package com.spectralsentinel.core.boundary;

import com.spectralsentinel.core.math.MedianFilter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * {@link BoundaryCalculator} backed by a fixed table of 101 margin factors, one
 * per integer sensitivity.
 *
 * <h3>Units</h3>
 * <p>
 * The unit of a point blends the absolute centered running median at that
 * point with the mean of those medians over the non-anomalous points (half and
 * half), and is never below {@code 1.0}.
 * </p>
 *
 * <h3>Margins</h3>
 * <p>
 * {@code margin = factor(sensitivity) * unit}, where {@code factor} is read from
 * the table and linearly interpolated between integer sensitivities. The table
 * decreases from roughly {@code 1.8e5} at sensitivity 0 to {@code 1.0} at 50 and
 * about {@code 1e-5} at 100; sensitivity 100 itself yields a zero margin.
 * </p>
 *
 * <h3>Scores</h3>
 * <p>
 * A flagged point scores the (fractional) number of sensitivity steps, divided
 * by 100, at which its distance from the expected value first fits inside the
 * margin.
 * </p>
 *
 * @since 1.0.0
 */
public class FactorTableBoundaryCalculator implements BoundaryCalculator {

    /** Largest median window used for unit estimation. */
    static final int MAX_UNIT_WINDOW = 512;

    private static final double TREND_FRACTION = 0.5;
    private static final int MAX_SENSITIVITY = 100;

    private static final double[] FACTORS = buildFactors();

    @Override
    public double[] boundaryUnits(double[] values, boolean[] isAnomaly) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(isAnomaly, "isAnomaly must not be null");
        requireSameLength(values.length, isAnomaly.length, "isAnomaly");

        int n = values.length;
        if (n == 0) {
            return new double[0];
        }

        int window = Math.min(n / 3, MAX_UNIT_WINDOW);
        double[] trends = MedianFilter.apply(values, window);
        double validSum = 0.0;
        int validCount = 0;
        for (int i = 0; i < n; i++) {
            trends[i] = Math.abs(trends[i]);
            if (!isAnomaly[i]) {
                validSum += trends[i];
                validCount++;
            }
        }

        double[] units = new double[n];
        double averagePart = validCount > 0 ? validSum / validCount : 0.0;
        for (int i = 0; i < n; i++) {
            units[i] = validCount > 0
                    ? TREND_FRACTION * trends[i] + averagePart * (1 - TREND_FRACTION)
                    : trends[i];
            if (!Double.isFinite(units[i])) {
                throw new IllegalStateException("Boundary unit at index " + i + " is not finite: " + units[i]);
            }
            units[i] = Math.max(units[i], 1.0);
        }
        return units;
    }

    @Override
    public double margin(double unit, double sensitivity) {
        if (!(sensitivity >= 0 && sensitivity <= MAX_SENSITIVITY)) {
            throw new IllegalArgumentException("sensitivity must be in [0, 100], got: " + sensitivity);
        }
        if (!(unit > 0)) {
            throw new IllegalArgumentException("unit must be a positive number, got: " + unit);
        }
        if (sensitivity == MAX_SENSITIVITY) {
            return 0.0;
        }
        int lb = (int) sensitivity;
        double factor = FACTORS[lb + 1] + (FACTORS[lb] - FACTORS[lb + 1]) * (1 - sensitivity + lb);
        return factor * unit;
    }

    @Override
    public double[] anomalyScores(double[] values, double[] expectedValues, double[] units,
            boolean[] isAnomaly) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(expectedValues, "expectedValues must not be null");
        Objects.requireNonNull(units, "units must not be null");
        Objects.requireNonNull(isAnomaly, "isAnomaly must not be null");
        requireSameLength(values.length, expectedValues.length, "expectedValues");
        requireSameLength(values.length, units.length, "units");
        requireSameLength(values.length, isAnomaly.length, "isAnomaly");

        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = isAnomaly[i] ? score(values[i], expectedValues[i], units[i]) : 0.0;
        }
        return scores;
    }

    private double score(double value, double expectedValue, double unit) {
        double distance = Math.abs(expectedValue - value);

        // ascending: margins[j] is the margin at sensitivity 100 - j
        double[] margins = new double[MAX_SENSITIVITY + 1];
        for (int j = 0; j <= MAX_SENSITIVITY; j++) {
            margins[j] = margin(unit, MAX_SENSITIVITY - j);
        }

        int lb = 0;
        while (lb < margins.length && margins[lb] < distance) {
            lb++;
        }
        if (lb == 0) {
            return 0.0;
        }
        if (lb >= MAX_SENSITIVITY) {
            return 1.0;
        }
        double a = margins[lb - 1];
        double b = margins[lb];
        return (lb - 1 + (distance - a) / (b - a)) / MAX_SENSITIVITY;
    }

    /**
     * @return a copy of the factor table, index = integer sensitivity
     */
    static double[] factors() {
        return FACTORS.clone();
    }

    private static double[] buildFactors() {
        Deque<Double> factors = new ArrayDeque<>();
        factors.add(1.0);
        for (int i = 0; i < 50; i++) {
            double last = factors.peekLast();
            factors.addLast(i < 40 ? last / (1.15 + 0.001 * i) : last / (1.25 + 0.01 * i));
        }
        for (int i = 0; i < 50; i++) {
            double first = factors.peekFirst();
            factors.addFirst(first * (1.25 + 0.001 * i));
        }
        return factors.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static void requireSameLength(int expected, int actual, String name) {
        if (expected != actual) {
            throw new IllegalArgumentException(
                    name + " must have the same length as values (" + expected + "), got: " + actual);
        }
    }
}
