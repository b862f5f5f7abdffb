/**
 * Boundary units, margins and margin-based anomaly scores.
 *
 * @since 1.0.0
 */
package com.spectralsentinel.core.boundary;
