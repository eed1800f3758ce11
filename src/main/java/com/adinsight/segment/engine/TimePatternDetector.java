package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.TimeDistribution;
import com.adinsight.segment.model.TimePattern;
import com.adinsight.segment.model.TimePatternResult;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies when anomalies were detected: concentrated on weekdays, on weekends,
 * on one recurring day, or spread evenly.
 *
 * Decision order:
 * 1. weekday share >= weekdaySpikeRatio  -> WEEKDAY_SPIKE (confidence = weekday share)
 * 2. weekend share >= weekendSpikeRatio  -> WEEKEND_SPIKE (confidence = weekend share)
 * 3. busiest day share > periodicDayRatio -> PERIODIC (confidence = that share)
 * 4. otherwise CONSISTENT (confidence = larger of the two shares)
 */
@Component
public class TimePatternDetector {

    private final SegmentAnalysisConfig config;

    public TimePatternDetector(SegmentAnalysisConfig config) {
        this.config = config;
    }

    public TimePatternResult detect(List<Anomaly> anomalies) {
        TimeDistribution distribution = distributionOf(anomalies);
        int total = distribution.total();

        if (total == 0) {
            return TimePatternResult.builder()
                    .pattern(TimePattern.CONSISTENT)
                    .confidence(0.0)
                    .details("No anomalies to analyze; weekday and weekend are evenly quiet.")
                    .recommendedMonitoring(recommendedMonitoring(TimePattern.CONSISTENT))
                    .distribution(distribution)
                    .build();
        }

        double weekdayShare = (double) distribution.getWeekday() / total;
        double weekendShare = (double) distribution.getWeekend() / total;
        SegmentAnalysisConfig.TimePatterns thresholds = config.getTimePatterns();

        TimePattern pattern;
        double confidence;
        String details;

        if (weekdayShare >= thresholds.getWeekdaySpikeRatio()) {
            pattern = TimePattern.WEEKDAY_SPIKE;
            confidence = weekdayShare;
            details = String.format("Anomalies are concentrated on weekdays (%d of %d). "
                    + "They may be tied to business-day activity or weekday bidding competition.",
                    distribution.getWeekday(), total);
        } else if (weekendShare >= thresholds.getWeekendSpikeRatio()) {
            pattern = TimePattern.WEEKEND_SPIKE;
            confidence = weekendShare;
            details = String.format("Anomalies are concentrated on the weekend (%d of %d). "
                    + "Check for shifts in weekend consumer behavior.",
                    distribution.getWeekend(), total);
        } else {
            Map.Entry<DayOfWeek, Integer> busiest = busiestDay(distribution);
            double busiestShare = busiest != null ? (double) busiest.getValue() / total : 0.0;

            if (busiestShare > thresholds.getPeriodicDayRatio()) {
                pattern = TimePattern.PERIODIC;
                confidence = busiestShare;
                details = String.format("Anomalies cluster on %s (%d of %d). "
                        + "Look for recurring events or scheduled changes on that day.",
                        dayName(busiest.getKey()), busiest.getValue(), total);
            } else {
                pattern = TimePattern.CONSISTENT;
                confidence = Math.max(weekdayShare, weekendShare);
                details = String.format("Anomalies are spread evenly across weekdays (%d) and the weekend (%d) "
                        + "with no dominant period.", distribution.getWeekday(), distribution.getWeekend());
            }
        }

        return TimePatternResult.builder()
                .pattern(pattern)
                .confidence(Math.min(1.0, confidence))
                .details(details)
                .recommendedMonitoring(recommendedMonitoring(pattern))
                .distribution(distribution)
                .build();
    }

    public TimeDistribution distributionOf(List<Anomaly> anomalies) {
        ZoneId zone = zone();
        Map<DayOfWeek, Integer> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            byDay.put(day, 0);
        }

        int weekday = 0;
        int weekend = 0;
        for (Anomaly anomaly : anomalies) {
            DayOfWeek day = dayOfWeek(anomaly.getDetectedAt(), zone);
            byDay.merge(day, 1, Integer::sum);
            if (isWeekend(day)) {
                weekend++;
            } else {
                weekday++;
            }
        }

        return TimeDistribution.builder()
                .weekday(weekday)
                .weekend(weekend)
                .byDayOfWeek(byDay)
                .build();
    }

    public ZoneId zone() {
        return ZoneId.of(config.getTimeZone());
    }

    public static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    static DayOfWeek dayOfWeek(Instant instant, ZoneId zone) {
        return instant.atZone(zone).getDayOfWeek();
    }

    private Map.Entry<DayOfWeek, Integer> busiestDay(TimeDistribution distribution) {
        Map.Entry<DayOfWeek, Integer> busiest = null;
        for (Map.Entry<DayOfWeek, Integer> entry : distribution.getByDayOfWeek().entrySet()) {
            if (busiest == null || entry.getValue() > busiest.getValue()) {
                busiest = entry;
            }
        }
        return busiest;
    }

    private static String dayName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static List<String> recommendedMonitoring(TimePattern pattern) {
        switch (pattern) {
            case WEEKDAY_SPIKE:
                return List.of(
                        "Monitor weekday morning campaign performance closely",
                        "Check that ad delivery hours match business activity hours",
                        "Review reallocating budget toward the weekend");
            case WEEKEND_SPIKE:
                return List.of(
                        "Analyze weekend consumer behavior patterns",
                        "Test weekend-specific creatives",
                        "Adjust weekend bidding strategy relative to weekdays");
            case PERIODIC:
                return List.of(
                        "Compare anomaly timing with recurring events",
                        "Check for overlap with scheduled reports or automated jobs",
                        "Review automation schedules for that day");
            case CONSISTENT:
            default:
                return List.of(
                        "Keep monitoring evenly across all days",
                        "Set a daily checkpoint for key metrics",
                        "Enable early alerts for trend changes");
        }
    }
}
