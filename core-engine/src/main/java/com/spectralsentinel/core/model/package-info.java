/**
 * Domain model for Spectral Sentinel.
 *
 * <ul>
 * <li>{@link com.spectralsentinel.core.model.TimeSeries}: the input, a
 * non-empty ordered list of
 * {@link com.spectralsentinel.core.model.TimePoint}s</li>
 * <li>{@link com.spectralsentinel.core.model.AnomalyReport}: the output, one
 * {@link com.spectralsentinel.core.model.AnomalyRecord} per input point</li>
 * <li>{@link com.spectralsentinel.core.model.MarginAnomalyRecord}: the record
 * shape produced when expected values and boundaries are requested</li>
 * <li>{@link com.spectralsentinel.core.model.DetectMode}: selects between the
 * two record shapes</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.model;
