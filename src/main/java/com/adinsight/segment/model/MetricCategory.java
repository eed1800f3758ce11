package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed semantic grouping of campaign metrics.
 * Metric names outside every set have no category.
 */
public enum MetricCategory {
    SPEND_RELATED("spend_related", "Spend", Set.of("spend", "cpa", "cpc", "budget")),
    ENGAGEMENT("engagement", "Engagement", Set.of("ctr", "clicks", "impressions")),
    CONVERSION("conversion", "Conversion", Set.of("conversions", "cvr", "roas", "revenue"));

    private final String value;
    private final String displayName;
    private final Set<String> metrics;

    MetricCategory(String value, String displayName, Set<String> metrics) {
        this.value = value;
        this.displayName = displayName;
        this.metrics = metrics;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Set<String> getMetrics() {
        return metrics;
    }

    public static Optional<MetricCategory> fromMetric(String metric) {
        if (metric == null) return Optional.empty();
        String normalized = metric.toLowerCase(Locale.ROOT);
        for (MetricCategory category : values()) {
            if (category.metrics.contains(normalized)) return Optional.of(category);
        }
        return Optional.empty();
    }
}
