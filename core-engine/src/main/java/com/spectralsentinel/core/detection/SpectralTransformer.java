package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.math.FourierTransform;
import com.spectralsentinel.core.math.MovingAverageFilter;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the spectral residual saliency map of a series.
 *
 * <ol>
 * <li>DFT of the values; amplitude spectrum {@code A}, with amplitudes
 * {@code <= EPS} clamped to {@code EPS}</li>
 * <li>log spectrum {@code L = ln(A)}, forced to 0 at clamped bins</li>
 * <li>residual {@code R = exp(L - movingAverage(L, magWindow))}</li>
 * <li>every bin rescaled by {@code R / A} (phase kept), clamped bins zeroed</li>
 * <li>inverse DFT; the saliency is the modulus of each sample</li>
 * </ol>
 *
 * <p>
 * The output has the length of the input. Callers that extended the series
 * first truncate the result back to the original length.
 * </p>
 *
 * @since 1.0.0
 */
public class SpectralTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralTransformer.class);

    /** Magnitudes and baselines at or below this value are clamped to it. */
    public static final double EPS = 1e-8;

    private final MovingAverageFilter filter;
    private final int magWindow;

    /**
     * @param filter    smoothing filter for the log spectrum
     * @param magWindow smoothing window; {@code >= 1}
     * @throws IllegalArgumentException if {@code magWindow < 1}
     */
    public SpectralTransformer(MovingAverageFilter filter, int magWindow) {
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        if (magWindow < 1) {
            throw new IllegalArgumentException("magWindow must be >= 1, got: " + magWindow);
        }
        this.magWindow = magWindow;
    }

    /**
     * @param values the (usually extended) series; must not be empty
     * @return saliency magnitude per input position
     */
    public double[] transform(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        Complex[] spectrum = FourierTransform.forward(values);
        int n = spectrum.length;

        double[] magnitude = FourierTransform.magnitudes(spectrum);
        boolean[] clamped = new boolean[n];
        double[] logMagnitude = new double[n];
        int clampedCount = 0;
        for (int i = 0; i < n; i++) {
            if (magnitude[i] <= EPS) {
                magnitude[i] = EPS;
                clamped[i] = true;
                clampedCount++;
            } else {
                logMagnitude[i] = Math.log(magnitude[i]);
            }
        }

        double[] smoothed = filter.apply(logMagnitude, magWindow);

        Complex[] residual = new Complex[n];
        for (int i = 0; i < n; i++) {
            if (clamped[i]) {
                residual[i] = Complex.ZERO;
                continue;
            }
            double saliency = Math.exp(logMagnitude[i] - smoothed[i]);
            double scale = saliency / magnitude[i];
            residual[i] = new Complex(spectrum[i].getReal() * scale, spectrum[i].getImaginary() * scale);
        }

        if (clampedCount > 0) {
            LOG.debug("Clamped {} of {} spectral magnitudes to EPS", clampedCount, n);
        }
        return FourierTransform.magnitudes(FourierTransform.inverse(residual));
    }

    public int getMagWindow() {
        return magWindow;
    }
}
