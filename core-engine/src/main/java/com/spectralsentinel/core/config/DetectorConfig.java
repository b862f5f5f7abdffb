package com.spectralsentinel.core.config;

import com.spectralsentinel.core.model.DetectMode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of a Spectral Residual detection run.
 *
 * <p>
 * Expected YAML structure (every key is optional; omitted keys keep the
 * defaults shown):
 * </p>
 *
 * <pre>
 * threshold: 0.3
 * magWindow: 3
 * scoreWindow: 40
 * sensitivity: 99
 * detectMode: AnomalyOnly      # or AnomalyAndMargin
 * batchSize: 0                 # &lt;= 0 means the whole series
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_THRESHOLD = 0.3;
    public static final int DEFAULT_MAG_WINDOW = 3;
    public static final int DEFAULT_SCORE_WINDOW = 40;
    public static final double DEFAULT_SENSITIVITY = 99;

    /** Score at or above which a point is a candidate anomaly. */
    private double threshold = DEFAULT_THRESHOLD;

    /** Moving-average window over the log amplitude spectrum. */
    private int magWindow = DEFAULT_MAG_WINDOW;

    /** Moving-average window over the saliency map. */
    private int scoreWindow = DEFAULT_SCORE_WINDOW;

    /** Margin sensitivity in [0, 100]; only used in margin mode. */
    private double sensitivity = DEFAULT_SENSITIVITY;

    /** "AnomalyOnly" or "AnomalyAndMargin". */
    private String detectMode = DetectMode.ANOMALY_ONLY.getValue();

    /** Points per independently detected batch; <= 0 disables batching. */
    private int batchSize;

    /**
     * Validate every parameter, collecting all problems into one message.
     *
     * @throws IllegalStateException if any parameter is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!Double.isFinite(threshold)) {
            errors.add("'threshold' must be a finite number, got: " + threshold);
        }
        if (magWindow < 1) {
            errors.add("'magWindow' must be >= 1, got: " + magWindow);
        }
        if (scoreWindow < 1) {
            errors.add("'scoreWindow' must be >= 1, got: " + scoreWindow);
        }
        if (!(sensitivity >= 0 && sensitivity <= 100)) {
            errors.add("'sensitivity' must be in [0, 100], got: " + sensitivity);
        }
        if (detectMode == null || detectMode.isBlank()) {
            errors.add("'detectMode' is required");
        } else {
            try {
                DetectMode.fromValue(detectMode);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorConfig: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed detect mode
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public DetectMode resolveDetectMode() {
        return DetectMode.fromValue(detectMode);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getMagWindow() {
        return magWindow;
    }

    public void setMagWindow(int magWindow) {
        this.magWindow = magWindow;
    }

    public int getScoreWindow() {
        return scoreWindow;
    }

    public void setScoreWindow(int scoreWindow) {
        this.scoreWindow = scoreWindow;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public void setSensitivity(double sensitivity) {
        this.sensitivity = sensitivity;
    }

    public String getDetectMode() {
        return detectMode;
    }

    public void setDetectMode(String detectMode) {
        this.detectMode = detectMode;
    }

    /**
     * Convenience setter taking the enum directly.
     */
    public DetectorConfig withDetectMode(DetectMode mode) {
        this.detectMode = Objects.requireNonNull(mode, "mode must not be null").getValue();
        return this;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && magWindow == that.magWindow
                && scoreWindow == that.scoreWindow
                && Double.compare(sensitivity, that.sensitivity) == 0
                && batchSize == that.batchSize
                && Objects.equals(detectMode, that.detectMode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threshold, magWindow, scoreWindow, sensitivity, detectMode, batchSize);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "threshold=" + threshold +
                ", magWindow=" + magWindow +
                ", scoreWindow=" + scoreWindow +
                ", sensitivity=" + sensitivity +
                ", detectMode='" + detectMode + '\'' +
                ", batchSize=" + batchSize +
                '}';
    }
}
