/**
 * Configuration loading and validation for the Spectral Residual detector.
 *
 * <p>
 * Parameters are defined in YAML and loaded by
 * {@link com.spectralsentinel.core.config.DetectorConfigLoader} into a
 * {@link com.spectralsentinel.core.config.DetectorConfig} instance, which is
 * validated right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.config;
