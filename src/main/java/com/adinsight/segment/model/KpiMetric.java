package com.adinsight.segment.model;

import java.util.function.ToDoubleFunction;

/**
 * KPI columns of a {@link DailyAggregate} that day-of-week baselines are computed for.
 */
public enum KpiMetric {
    IMPRESSIONS("impressions", DailyAggregate::getTotalImpressions),
    CLICKS("clicks", DailyAggregate::getTotalClicks),
    CONVERSIONS("conversions", DailyAggregate::getTotalConversions),
    SPEND("spend", DailyAggregate::getTotalSpend),
    REVENUE("revenue", DailyAggregate::getTotalRevenue);

    private final String key;
    private final ToDoubleFunction<DailyAggregate> extractor;

    KpiMetric(String key, ToDoubleFunction<DailyAggregate> extractor) {
        this.key = key;
        this.extractor = extractor;
    }

    public String getKey() {
        return key;
    }

    public double valueOf(DailyAggregate aggregate) {
        return extractor.applyAsDouble(aggregate);
    }
}
