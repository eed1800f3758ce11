package com.adinsight.segment.testutil;

import com.adinsight.segment.model.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    // Matches the SegmentAnalysisConfig default time zone
    public static final ZoneId ZONE = ZoneId.of("UTC");

    // 2025-01-06 is a Monday
    public static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    private static final AtomicInteger SEQ = new AtomicInteger();

    private TestDataFactory() {}

    /**
     * Noon of the given day in {@link #ZONE}.
     */
    public static Instant at(LocalDate day) {
        return at(day, 12);
    }

    public static Instant at(LocalDate day, int hour) {
        return day.atTime(hour, 0).atZone(ZONE).toInstant();
    }

    public static Anomaly.AnomalyBuilder anomaly() {
        return Anomaly.builder()
                .id("anomaly-" + SEQ.incrementAndGet())
                .campaignId("campaign-1")
                .campaignName("Test Campaign")
                .type(AnomalyType.SPIKE)
                .severity(Severity.WARNING)
                .metric("ctr")
                .currentValue(3.5)
                .previousValue(2.0)
                .changePercent(75.0)
                .message("CTR rose 75%")
                .detectedAt(at(MONDAY))
                .detail(AnomalyDetail.builder()
                        .detectionMethod(DetectionMethod.ZSCORE)
                        .zscore(2.8)
                        .baseline(StatisticalBaseline.builder()
                                .mean(2.0).stdDev(0.3).median(2.0).q1(1.7).q3(2.3).iqr(0.6)
                                .min(1.5).max(2.8).percentile95(2.6).sampleSize(14)
                                .build())
                        .historicalTrend(HistoricalTrend.STABLE)
                        .build())
                .recommendations(List.of("Investigate the CTR change"));
    }

    public static Anomaly createAnomaly(String campaignId, String metric, Severity severity) {
        return anomaly()
                .campaignId(campaignId)
                .campaignName("Campaign " + campaignId)
                .metric(metric)
                .severity(severity)
                .build();
    }

    public static DailyAggregate createAggregate(LocalDate date) {
        return aggregate(date).build();
    }

    public static DailyAggregate.DailyAggregateBuilder aggregate(LocalDate date) {
        return DailyAggregate.builder()
                .date(date)
                .totalImpressions(10000)
                .totalClicks(500)
                .totalConversions(50)
                .totalSpend(100000.0)
                .totalRevenue(500000.0);
    }

    public static Insight createInsight(String id, InsightType type, double confidence) {
        return Insight.builder()
                .id(id)
                .type(type)
                .title("Insight " + id)
                .description("Description of " + id)
                .confidence(confidence)
                .build();
    }
}
