package com.phishguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk tier derived from a rounded 0–100 score.
 *
 * <pre>
 *   score &lt;= 30        → LOW
 *   30 &lt; score &lt;= 60  → MEDIUM
 *   score &gt;  60        → HIGH
 * </pre>
 *
 * <p>Dashboard and report code must bucket through {@link #fromScore(int)}
 * rather than repeating the thresholds.
 */
public enum RiskLabel {
    LOW("Low Risk"),
    MEDIUM("Medium Risk"),
    HIGH("High Risk");

    public static final int LOW_MAX    = 30;
    public static final int MEDIUM_MAX = 60;

    private final String displayName;

    RiskLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    public static RiskLabel fromScore(int score) {
        if (score > MEDIUM_MAX) return HIGH;
        if (score > LOW_MAX)    return MEDIUM;
        return LOW;
    }

    /**
     * Accepts either the display name ("High Risk") or the enum name ("HIGH").
     */
    @JsonCreator
    public static RiskLabel parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Risk label must not be null");
        }
        String trimmed = value.trim();
        for (RiskLabel label : values()) {
            if (label.displayName.equalsIgnoreCase(trimmed) || label.name().equalsIgnoreCase(trimmed)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown risk label: " + value);
    }
}
