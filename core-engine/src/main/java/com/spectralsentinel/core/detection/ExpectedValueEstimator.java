package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.math.AnomalyInterpolator;
import com.spectralsentinel.core.math.FourierTransform;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Reconstructs the value each point would have had without anomalies.
 *
 * <p>
 * Anomalous points are first replaced by the {@link AnomalyInterpolator}.
 * The cleaned series of length {@code L} is transformed and every bin
 * {@code i} with {@code 3L/8 < i < 5L/8} is zeroed. For a real input this band
 * holds the highest frequencies, mirrored around {@code L/2}, so keeping both
 * ends of the spectrum amounts to a low-pass filter. The real part of the
 * inverse transform is the expected value series.
 * </p>
 *
 * @since 1.0.0
 */
public class ExpectedValueEstimator {

    private final AnomalyInterpolator interpolator;

    public ExpectedValueEstimator(AnomalyInterpolator interpolator) {
        this.interpolator = Objects.requireNonNull(interpolator, "interpolator must not be null");
    }

    /**
     * @param values         the original series values
     * @param anomalyIndices positions flagged by the score threshold
     * @return expected values, index-aligned with {@code values}
     */
    public double[] estimate(double[] values, int[] anomalyIndices) {
        double[] clean = interpolator.removeAnomalies(values, anomalyIndices);
        int length = clean.length;

        Complex[] spectrum = FourierTransform.forward(clean);
        double lower = length * 3 / 8.0;
        double upper = length * 5 / 8.0;
        for (int i = 0; i < length; i++) {
            if (i > lower && i < upper) {
                spectrum[i] = Complex.ZERO;
            }
        }

        Complex[] reconstructed = FourierTransform.inverse(spectrum);
        double[] expected = new double[length];
        for (int i = 0; i < length; i++) {
            expected[i] = reconstructed[i].getReal();
        }
        return expected;
    }
}
