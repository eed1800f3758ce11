package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SegmentType {
    CAMPAIGN("campaign");

    private final String value;

    SegmentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
