package com.spectralsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Detection result for one point of the input series.
 *
 * <p>
 * This is the basic shape produced in {@link DetectMode#ANOMALY_ONLY} mode.
 * Margin-mode runs produce {@link MarginAnomalyRecord}, which adds the expected
 * value and the accepted range around it. Use {@link #hasMargin()} to tell the
 * two apart without an {@code instanceof} check.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp} is required; the score must lie in
 * {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "id", "timestamp", "value", "mag", "score", "isAnomaly" })
public class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Position of the point in the input series. */
    private final int id;

    private final Instant timestamp;
    private final double value;

    /** Spectral residual saliency magnitude. */
    private final double mag;

    /** Anomaly score in {@code [0, 1]}. */
    private final double score;

    private final boolean anomaly;

    protected AnomalyRecord(int id, Instant timestamp, double value, double mag, double score,
            boolean anomaly) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got: " + id);
        }
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new IllegalArgumentException("score must be in [0, 1], got: " + score);
        }
        this.id = id;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
        this.mag = mag;
        this.score = score;
        this.anomaly = anomaly;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    public static class Builder {
        private int id;
        private Instant timestamp;
        private double value;
        private double mag;
        private double score;
        private boolean anomaly;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder mag(double mag) {
            this.mag = mag;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder anomaly(boolean anomaly) {
            this.anomaly = anomaly;
            return this;
        }

        /**
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException     if {@code timestamp} is {@code null}
         * @throws IllegalArgumentException if {@code id} is negative or the score
         *                                  is outside {@code [0, 1]}
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(id, timestamp, value, mag, score, anomaly);
        }
    }

    /**
     * Return a copy of this record carrying a different id. Used when batch
     * results are concatenated and renumbered.
     *
     * @param newId the new id
     * @return a record of the same shape with {@code newId}
     */
    public AnomalyRecord withId(int newId) {
        return new AnomalyRecord(newId, timestamp, value, mag, score, anomaly);
    }

    /**
     * @return {@code true} if this record carries expected value and boundaries
     */
    public boolean hasMargin() {
        return false;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public double getMag() {
        return mag;
    }

    public double getScore() {
        return score;
    }

    @JsonProperty("isAnomaly")
    public boolean isAnomaly() {
        return anomaly;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        AnomalyRecord that = (AnomalyRecord) o;
        return id == that.id
                && Double.compare(value, that.value) == 0
                && Double.compare(mag, that.mag) == 0
                && Double.compare(score, that.score) == 0
                && anomaly == that.anomaly
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, value, mag, score, anomaly);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "id=" + id +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", mag=" + mag +
                ", score=" + score +
                ", isAnomaly=" + anomaly +
                '}';
    }
}
