package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.model.AnomalyReport;
import com.spectralsentinel.core.model.DetectMode;

/**
 * Contract for detectors bound to a single series.
 *
 * <p>
 * An instance is constructed with its series and parameters and produces one
 * {@link AnomalyReport}. Implementations compute the report at most once;
 * repeated {@link #detect()} calls return the same instance.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Run detection, or return the cached report of an earlier run.
     *
     * @return the report, one record per input point
     */
    AnomalyReport detect();

    /**
     * @return the mode that determines the shape of the report's records
     */
    DetectMode getDetectMode();
}
