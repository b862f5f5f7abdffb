package com.spectralsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, non-empty sequence of {@link TimePoint}s.
 *
 * <p>
 * The series is assumed to be sorted chronologically and sampled at a
 * uniform interval. Neither property is checked: the Fourier transform only
 * looks at the values, in order.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<TimePoint> points;

    /**
     * @param points the observations in chronological order
     * @throws NullPointerException     if {@code points} or any element is
     *                                  {@code null}
     * @throws IllegalArgumentException if {@code points} is empty
     */
    public TimeSeries(List<TimePoint> points) {
        Objects.requireNonNull(points, "Series points must not be null");
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Series must contain at least one point");
        }
        List<TimePoint> copy = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            copy.add(Objects.requireNonNull(points.get(i), "Point at index " + i + " is null"));
        }
        this.points = Collections.unmodifiableList(copy);
    }

    /**
     * Build a series from raw values, stamping them {@code step} apart starting
     * at {@code start}.
     *
     * @param start  timestamp of the first value
     * @param step   sampling interval
     * @param values the observed values
     * @return a new series
     */
    public static TimeSeries ofValues(Instant start, Duration step, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(values, "values must not be null");
        List<TimePoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(TimePoint.of(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new TimeSeries(points);
    }

    public int size() {
        return points.size();
    }

    public TimePoint get(int index) {
        return points.get(index);
    }

    /**
     * @return unmodifiable view of the points
     */
    public List<TimePoint> getPoints() {
        return points;
    }

    /**
     * @return a fresh array holding the values in order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * Return the points in {@code [from, to)} as a new series.
     *
     * @throws IndexOutOfBoundsException if the range is out of bounds
     * @throws IllegalArgumentException  if the range is empty
     */
    public TimeSeries slice(int from, int to) {
        return new TimeSeries(points.subList(from, to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSeries{size=" + points.size()
                + ", first=" + points.get(0).getTimestamp()
                + ", last=" + points.get(points.size() - 1).getTimestamp() + '}';
    }
}
