package com.spectralsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Selects which columns a detection run produces.
 *
 * @since 1.0.0
 */
public enum DetectMode {

    /** Saliency, score and anomaly flag only. */
    ANOMALY_ONLY("AnomalyOnly"),

    /** Adds expected value and lower/upper boundary per point. */
    ANOMALY_AND_MARGIN("AnomalyAndMargin");

    private final String value;

    DetectMode(String value) {
        this.value = value;
    }

    /**
     * @return the external name, e.g. {@code AnomalyAndMargin}
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a mode from either its external name ({@code AnomalyOnly}) or
     * its constant name ({@code anomaly_only}), ignoring case.
     *
     * @param text the mode name; must not be {@code null}
     * @return the matching mode
     * @throws IllegalArgumentException if nothing matches
     */
    @JsonCreator
    public static DetectMode fromValue(String text) {
        Objects.requireNonNull(text, "Detect mode must not be null");
        String normalized = text.trim();
        for (DetectMode mode : values()) {
            if (mode.value.equalsIgnoreCase(normalized)
                    || mode.name().equals(normalized.toUpperCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown detect mode: '" + text
                + "'. Supported modes: AnomalyOnly, AnomalyAndMargin");
    }
}
