/**
 * File-in / file-out batch runner for the Spectral Residual detector.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.spectralsentinel.batch.SpectralSentinelJob}: main entry
 * point</li>
 * <li>{@link com.spectralsentinel.batch.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.spectralsentinel.batch.SeriesReader}: JSON series
 * input</li>
 * <li>{@link com.spectralsentinel.batch.ReportWriter}: JSON report
 * output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.batch;
