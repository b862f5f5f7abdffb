package com.spectralsentinel.core.boundary;

/**
 * Turns expected values into an accepted range per point and rescales anomaly
 * scores against that range.
 *
 * <p>
 * Used only in {@link com.spectralsentinel.core.model.DetectMode#ANOMALY_AND_MARGIN}
 * mode. All array arguments are index-aligned with the input series and are
 * never modified.
 * </p>
 *
 * @since 1.0.0
 */
public interface BoundaryCalculator {

    /**
     * Estimate a dispersion scale for every point.
     *
     * @param values    the original series values
     * @param isAnomaly score-based anomaly flags
     * @return one strictly positive unit per point
     */
    double[] boundaryUnits(double[] values, boolean[] isAnomaly);

    /**
     * Convert a unit into a symmetric margin width.
     *
     * @param unit        boundary unit; must be {@code > 0}
     * @param sensitivity in {@code [0, 100]}; higher values give narrower
     *                    margins, {@code 100} gives zero
     * @return the margin, {@code >= 0}
     * @throws IllegalArgumentException if either argument is out of range
     */
    double margin(double unit, double sensitivity);

    /**
     * Score every point by how far it lies from its expected value, measured in
     * margin steps.
     *
     * @param values         the original series values
     * @param expectedValues reconstructed expected values
     * @param units          boundary units from {@link #boundaryUnits}
     * @param isAnomaly      score-based anomaly flags; unflagged points score 0
     * @return scores in {@code [0, 1]}
     */
    double[] anomalyScores(double[] values, double[] expectedValues, double[] units, boolean[] isAnomaly);
}
