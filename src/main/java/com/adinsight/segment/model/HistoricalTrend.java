package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoricalTrend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    VOLATILE("volatile");

    private final String value;

    HistoricalTrend(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static HistoricalTrend fromValue(String value) {
        for (HistoricalTrend trend : values()) {
            if (trend.value.equalsIgnoreCase(value)) return trend;
        }
        throw new IllegalArgumentException("Unknown historical trend: " + value);
    }
}
