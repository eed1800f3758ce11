package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    ZSCORE("zscore"),
    IQR("iqr"),
    MOVING_AVERAGE("moving_average"),
    THRESHOLD("threshold");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        for (DetectionMethod method : values()) {
            if (method.value.equalsIgnoreCase(value)) return method;
        }
        throw new IllegalArgumentException("Unknown detection method: " + value);
    }
}
