package com.spectralsentinel.core.math;

/**
 * Replaces anomalous values with an estimate derived from their clean
 * neighbours.
 *
 * <p>
 * Contract: the result has the same length as {@code values}; positions not
 * listed in {@code anomalyIndices} are copied unchanged; the input array is
 * not modified. Indices may arrive in any order and may repeat.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AnomalyInterpolator {

    /**
     * @param values         the original values
     * @param anomalyIndices positions to replace
     * @return a cleaned copy of {@code values}
     * @throws IndexOutOfBoundsException if an index lies outside {@code values}
     */
    double[] removeAnomalies(double[] values, int[] anomalyIndices);
}
