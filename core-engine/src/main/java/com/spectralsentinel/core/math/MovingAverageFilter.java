package com.spectralsentinel.core.math;

/**
 * Smoothing filter used by the spectral transform (over log-magnitudes) and by
 * score generation (over saliency magnitudes).
 *
 * <p>
 * Contract: the result has the same length as the input, and position
 * {@code i} holds the arithmetic mean of a window of input values around or
 * before {@code i}. A constant input yields the same constant. Implementations
 * must be stateless and must not modify the input.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MovingAverageFilter {

    /**
     * @param values input values; must not be {@code null}
     * @param window window size; must be {@code >= 1}
     * @return smoothed values, same length as {@code values}
     * @throws IllegalArgumentException if {@code window < 1}
     */
    double[] apply(double[] values, int window);
}
