/**
 * Spectral Residual detection pipeline.
 *
 * <p>
 * {@link com.spectralsentinel.core.detection.SpectralResidualDetector} drives
 * the stages below and assembles the
 * {@link com.spectralsentinel.core.model.AnomalyReport}:
 * </p>
 * <ul>
 * <li>{@link com.spectralsentinel.core.detection.SeriesExtender}: predicted
 * tail against Fourier edge effects</li>
 * <li>{@link com.spectralsentinel.core.detection.SpectralTransformer}:
 * saliency map</li>
 * <li>{@link com.spectralsentinel.core.detection.ScoreGenerator}: scores in
 * [0, 1]</li>
 * <li>{@link com.spectralsentinel.core.detection.ExpectedValueEstimator}:
 * low-pass reconstruction of the cleaned series</li>
 * </ul>
 *
 * <p>
 * Use {@link com.spectralsentinel.core.detection.DetectorFactory} for a
 * detector with the default collaborators.
 * </p>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.detection;
