package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.boundary.FactorTableBoundaryCalculator;
import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.math.LeastSquaresInterpolator;
import com.spectralsentinel.core.math.TrailingAverageFilter;
import com.spectralsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances wired with the
 * default collaborators.
 *
 * <ul>
 * <li>{@link TrailingAverageFilter} for both smoothing steps</li>
 * <li>{@link LeastSquaresInterpolator} for anomaly removal</li>
 * <li>{@link FactorTableBoundaryCalculator} for units, margins and scores</li>
 * </ul>
 *
 * <p>
 * Construct {@link SpectralResidualDetector} directly to substitute any of
 * them.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector for the given series.
     *
     * @param series the series to analyse; must not be {@code null}
     * @param config detection parameters; must not be {@code null}
     * @return a new, not yet computed detector
     * @throws NullPointerException     if an argument is {@code null}
     * @throws IllegalArgumentException if the series is too short or a value
     *                                  exceeds {@link SpectralResidualDetector#MAX_ABS_VALUE}
     * @throws IllegalStateException    if the configuration is invalid
     */
    public static AnomalyDetector create(TimeSeries series, DetectorConfig config) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(config, "config must not be null");
        LOG.debug("Creating detector for {} with {}", series, config);
        return new SpectralResidualDetector(series, config,
                new TrailingAverageFilter(),
                new LeastSquaresInterpolator(),
                new FactorTableBoundaryCalculator());
    }
}
