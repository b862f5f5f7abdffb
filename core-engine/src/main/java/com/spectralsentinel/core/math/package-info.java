/**
 * Numeric building blocks: arbitrary-length Fourier transform, moving-average
 * and median filters, and anomaly interpolation.
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.math;
