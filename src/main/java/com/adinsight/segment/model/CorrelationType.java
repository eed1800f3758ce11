package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CorrelationType {
    POSITIVE("positive"),
    NEGATIVE("negative");

    private final String value;

    CorrelationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
