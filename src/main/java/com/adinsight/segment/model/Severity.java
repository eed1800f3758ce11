package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative anomaly severity and its ordinal weight.
 * Every score that aggregates severity (segment ranking, health score,
 * category averages, propagation impact) reads the weight from here.
 */
public enum Severity {
    CRITICAL("critical", 3),
    WARNING("warning", 2),
    INFO("info", 1);

    private final String value;
    private final int weight;

    Severity(String value, int weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isAboveInfo() {
        return weight > INFO.weight;
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        for (Severity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) return severity;
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
