package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    SPIKE("spike"),
    DROP("drop"),
    TREND_REVERSAL("trend_reversal"),
    BUDGET_ANOMALY("budget_anomaly"),
    PERFORMANCE_DEGRADATION("performance_degradation"),
    UNUSUAL_PATTERN("unusual_pattern");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyType fromValue(String value) {
        for (AnomalyType type : values()) {
            if (type.value.equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown anomaly type: " + value);
    }
}
