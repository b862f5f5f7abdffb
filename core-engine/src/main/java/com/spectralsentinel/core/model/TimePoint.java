package com.spectralsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a time series.
 *
 * <p>
 * Instances are immutable. The value must be a finite number; the detection
 * pipeline performs Fourier arithmetic on it and cannot recover from
 * {@code NaN} or infinities.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value; must be finite
     * @throws NullPointerException     if {@code timestamp} is {@code null}
     * @throws IllegalArgumentException if {@code value} is not finite
     */
    @JsonCreator
    public TimePoint(@JsonProperty(value = "timestamp", required = true) Instant timestamp,
            @JsonProperty(value = "value", required = true) double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "value must be a finite number at " + timestamp + ", got: " + value);
        }
        this.value = value;
    }

    public static TimePoint of(Instant timestamp, double value) {
        return new TimePoint(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimePoint that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "TimePoint{timestamp=" + timestamp + ", value=" + value + '}';
    }
}
