package com.adinsight.segment.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "segment-analysis")
public class SegmentAnalysisConfig {

    // Zone used to turn detectedAt instants into calendar days (weekday/weekend, campaign-day buckets).
    private String timeZone = "UTC";

    private TimePatterns timePatterns = new TimePatterns();

    private Correlation correlation = new Correlation();

    private Propagation propagation = new Propagation();

    private Insights insights = new Insights();

    private HealthScore healthScore = new HealthScore();

    @Data
    public static class TimePatterns {
        // Weekday share at or above which the set is a weekday spike.
        private double weekdaySpikeRatio = 0.8;
        // Weekend share at or above which the set is a weekend spike.
        private double weekendSpikeRatio = 0.8;
        // Share of a single day above which the set is periodic.
        private double periodicDayRatio = 0.4;
        // |value - dayOfWeekMean| / dayOfWeekMean above which a KPI day is flagged.
        private double kpiDeviationRatio = 0.5;
    }

    @Data
    public static class Correlation {
        // Campaign-day samples a metric pair needs before a correlation is reported.
        private int minSamples = 2;
        // Share of agreeing (or opposing) samples required to call the direction.
        private double directionRatio = 0.7;
    }

    @Data
    public static class Propagation {
        // Max distance from the root anomaly for a later anomaly to join its cluster.
        private long windowHours = 6;
    }

    @Data
    public static class Insights {
        // Critical anomalies in one campaign that make it high-risk.
        private int highRiskCriticalCount = 2;
        // Share of all anomalies one metric must exceed to count as concentrated.
        private double metricConcentrationRatio = 0.4;
        // Time patterns at or below this confidence produce no insight.
        private double timePatternMinConfidence = 0.6;
    }

    @Data
    public static class HealthScore {
        private double base = 100.0;
        private double perAnomalyPenalty = 10.0;
        private double perSeverityPenalty = 15.0;
    }
}
