package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.math.MovingAverageFilter;

import java.util.Objects;

/**
 * Converts saliency magnitudes into anomaly scores in {@code [0, 1]}.
 *
 * <p>
 * Each magnitude is compared with its local moving average:
 * {@code score = clamp(|mag - avg| / avg / 10, 0, 1)}, with averages
 * {@code <= EPS} raised to {@code EPS}.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoreGenerator {

    /** Fixed divisor that maps relative deviations onto the score range. */
    static final double SCORE_NORMALIZER = 10.0;

    private final MovingAverageFilter filter;
    private final int scoreWindow;

    /**
     * @param filter      baseline filter
     * @param scoreWindow baseline window; {@code >= 1}
     * @throws IllegalArgumentException if {@code scoreWindow < 1}
     */
    public ScoreGenerator(MovingAverageFilter filter, int scoreWindow) {
        this.filter = Objects.requireNonNull(filter, "filter must not be null");
        if (scoreWindow < 1) {
            throw new IllegalArgumentException("scoreWindow must be >= 1, got: " + scoreWindow);
        }
        this.scoreWindow = scoreWindow;
    }

    public double[] score(double[] magnitudes) {
        Objects.requireNonNull(magnitudes, "magnitudes must not be null");
        double[] baseline = filter.apply(magnitudes, scoreWindow);
        double[] scores = new double[magnitudes.length];
        for (int i = 0; i < magnitudes.length; i++) {
            double avg = baseline[i] <= SpectralTransformer.EPS ? SpectralTransformer.EPS : baseline[i];
            double raw = Math.abs(magnitudes[i] - avg) / avg;
            scores[i] = Math.max(0.0, Math.min(1.0, raw / SCORE_NORMALIZER));
        }
        return scores;
    }

    public int getScoreWindow() {
        return scoreWindow;
    }
}
