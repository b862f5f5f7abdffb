package com.spectralsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Detection result produced in {@link DetectMode#ANOMALY_AND_MARGIN} mode.
 *
 * <p>
 * Extends the basic record with the reconstructed expected value and the
 * symmetric range {@code [lowerBoundary, upperBoundary]} accepted around it.
 * The constructor enforces
 * {@code lowerBoundary <= expectedValue <= upperBoundary}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "id", "timestamp", "value", "mag", "score", "isAnomaly",
        "expectedValue", "lowerBoundary", "upperBoundary" })
public final class MarginAnomalyRecord extends AnomalyRecord {

    private static final long serialVersionUID = 1L;

    private final double expectedValue;
    private final double lowerBoundary;
    private final double upperBoundary;

    private MarginAnomalyRecord(AnomalyRecord base, double expectedValue,
            double lowerBoundary, double upperBoundary) {
        super(base.getId(), base.getTimestamp(), base.getValue(), base.getMag(),
                base.getScore(), base.isAnomaly());
        if (!(lowerBoundary <= expectedValue && expectedValue <= upperBoundary)) {
            throw new IllegalArgumentException("Boundaries must enclose the expected value: lower="
                    + lowerBoundary + ", expected=" + expectedValue + ", upper=" + upperBoundary);
        }
        this.expectedValue = expectedValue;
        this.lowerBoundary = lowerBoundary;
        this.upperBoundary = upperBoundary;
    }

    /**
     * Attach margin columns to a basic record.
     *
     * @param base          the basic record (id, value, score, flag)
     * @param expectedValue reconstructed expected value
     * @param lowerBoundary lower end of the accepted range
     * @param upperBoundary upper end of the accepted range
     * @return a new margin record
     * @throws IllegalArgumentException if the boundaries do not enclose the
     *                                  expected value
     */
    public static MarginAnomalyRecord of(AnomalyRecord base, double expectedValue,
            double lowerBoundary, double upperBoundary) {
        Objects.requireNonNull(base, "base record must not be null");
        return new MarginAnomalyRecord(base, expectedValue, lowerBoundary, upperBoundary);
    }

    @Override
    public MarginAnomalyRecord withId(int newId) {
        return new MarginAnomalyRecord(super.withId(newId), expectedValue, lowerBoundary, upperBoundary);
    }

    @Override
    public boolean hasMargin() {
        return true;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getLowerBoundary() {
        return lowerBoundary;
    }

    public double getUpperBoundary() {
        return upperBoundary;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o))
            return false;
        MarginAnomalyRecord that = (MarginAnomalyRecord) o;
        return Double.compare(expectedValue, that.expectedValue) == 0
                && Double.compare(lowerBoundary, that.lowerBoundary) == 0
                && Double.compare(upperBoundary, that.upperBoundary) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), expectedValue, lowerBoundary, upperBoundary);
    }

    @Override
    public String toString() {
        return "MarginAnomalyRecord{" +
                "id=" + getId() +
                ", timestamp=" + getTimestamp() +
                ", value=" + getValue() +
                ", score=" + getScore() +
                ", isAnomaly=" + isAnomaly() +
                ", expectedValue=" + expectedValue +
                ", lowerBoundary=" + lowerBoundary +
                ", upperBoundary=" + upperBoundary +
                '}';
    }
}
