package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimePattern {
    WEEKDAY_SPIKE("weekday_spike"),
    WEEKEND_SPIKE("weekend_spike"),
    PERIODIC("periodic"),
    CONSISTENT("consistent");

    private final String value;

    TimePattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
