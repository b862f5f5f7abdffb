package com.spectralsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered collection of {@link AnomalyRecord}s, one per input point.
 *
 * <p>
 * Record ids form the dense sequence {@code 0..size-1} in input order, and
 * every record has the shape that matches the report's {@link DetectMode}:
 * {@link MarginAnomalyRecord} for {@link DetectMode#ANOMALY_AND_MARGIN},
 * plain {@link AnomalyRecord} otherwise. Both rules are checked at
 * construction.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "detectMode", "records" })
public final class AnomalyReport implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DetectMode detectMode;
    private final List<AnomalyRecord> records;

    /**
     * @param detectMode the mode that produced the records
     * @param records    the records in input order
     * @throws IllegalArgumentException if ids are not {@code 0..n-1} in order or
     *                                  a record has the wrong shape for the mode
     */
    public AnomalyReport(DetectMode detectMode, List<? extends AnomalyRecord> records) {
        this.detectMode = Objects.requireNonNull(detectMode, "detectMode must not be null");
        Objects.requireNonNull(records, "records must not be null");

        boolean marginExpected = detectMode == DetectMode.ANOMALY_AND_MARGIN;
        List<AnomalyRecord> copy = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            AnomalyRecord record = Objects.requireNonNull(records.get(i),
                    "Record at index " + i + " is null");
            if (record.getId() != i) {
                throw new IllegalArgumentException(
                        "Record ids must be dense and ordered: expected " + i + ", got " + record.getId());
            }
            if (record.hasMargin() != marginExpected) {
                throw new IllegalArgumentException("Record " + i + " does not match detect mode " + detectMode);
            }
            copy.add(record);
        }
        this.records = Collections.unmodifiableList(copy);
    }

    public DetectMode getDetectMode() {
        return detectMode;
    }

    /**
     * @return unmodifiable list of records
     */
    public List<AnomalyRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public AnomalyRecord get(int id) {
        return records.get(id);
    }

    /**
     * @return ids of the records flagged as anomalous, ascending
     */
    @JsonIgnore
    public List<Integer> getAnomalyIds() {
        List<Integer> ids = new ArrayList<>();
        for (AnomalyRecord record : records) {
            if (record.isAnomaly()) {
                ids.add(record.getId());
            }
        }
        return ids;
    }

    @JsonIgnore
    public long getAnomalyCount() {
        return records.stream().filter(AnomalyRecord::isAnomaly).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyReport that))
            return false;
        return detectMode == that.detectMode && records.equals(that.records);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectMode, records);
    }

    @Override
    public String toString() {
        return "AnomalyReport{detectMode=" + detectMode
                + ", size=" + records.size()
                + ", anomalies=" + getAnomalyCount() + '}';
    }
}
