package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Insight category. Declaration order is the ranking order (warnings first).
 */
public enum InsightType {
    WARNING("warning"),
    RECOMMENDATION("recommendation"),
    INFO("info");

    private final String value;

    InsightType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
