package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.DailyAggregate;
import com.adinsight.segment.model.KpiMetric;
import com.adinsight.segment.model.KpiTimePatternResult;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes weekday, weekend and day-of-week KPI baselines from daily aggregates
 * and flags days that deviate sharply from their own day-of-week baseline.
 *
 * A Monday is only compared against the mean of the other Mondays, never against a
 * global mean, so a normally busy Monday is not flagged for being busier than Sunday.
 * A weekday seen only once has no baseline and is never flagged.
 */
@Component
public class KpiTimePatternAnalyzer {

    private final SegmentAnalysisConfig config;

    public KpiTimePatternAnalyzer(SegmentAnalysisConfig config) {
        this.config = config;
    }

    public KpiTimePatternResult analyze(List<DailyAggregate> aggregates) {
        List<DailyAggregate> weekdayRows = new ArrayList<>();
        List<DailyAggregate> weekendRows = new ArrayList<>();
        Map<DayOfWeek, List<DailyAggregate>> rowsByDay = new EnumMap<>(DayOfWeek.class);

        for (DailyAggregate aggregate : aggregates) {
            DayOfWeek day = aggregate.getDate().getDayOfWeek();
            rowsByDay.computeIfAbsent(day, k -> new ArrayList<>()).add(aggregate);
            if (TimePatternDetector.isWeekend(day)) {
                weekendRows.add(aggregate);
            } else {
                weekdayRows.add(aggregate);
            }
        }

        Map<DayOfWeek, Map<String, Double>> dayOfWeekAvg = new EnumMap<>(DayOfWeek.class);
        rowsByDay.forEach((day, rows) -> dayOfWeekAvg.put(day, averages(rows)));

        return KpiTimePatternResult.builder()
                .weekdayAvg(averages(weekdayRows))
                .weekendAvg(averages(weekendRows))
                .dayOfWeekAvg(dayOfWeekAvg)
                .anomalyDays(findAnomalyDays(aggregates, rowsByDay))
                .build();
    }

    private List<LocalDate> findAnomalyDays(List<DailyAggregate> aggregates,
                                            Map<DayOfWeek, List<DailyAggregate>> rowsByDay) {
        double maxDeviation = config.getTimePatterns().getKpiDeviationRatio();

        Map<DayOfWeek, Map<KpiMetric, Double>> sumsByDay = new EnumMap<>(DayOfWeek.class);
        rowsByDay.forEach((day, rows) -> sumsByDay.put(day, sums(rows)));

        Set<LocalDate> flagged = new LinkedHashSet<>();
        for (DailyAggregate aggregate : aggregates) {
            DayOfWeek day = aggregate.getDate().getDayOfWeek();
            int sameDayCount = rowsByDay.get(day).size();
            if (sameDayCount < 2) continue;

            Map<KpiMetric, Double> sums = sumsByDay.get(day);
            for (KpiMetric metric : KpiMetric.values()) {
                double value = metric.valueOf(aggregate);
                // baseline excludes the row under test
                double baseline = (sums.get(metric) - value) / (sameDayCount - 1);
                if (baseline == 0.0) continue;

                if (Math.abs(value - baseline) / baseline > maxDeviation) {
                    flagged.add(aggregate.getDate());
                    break;
                }
            }
        }
        return new ArrayList<>(flagged);
    }

    private static Map<KpiMetric, Double> sums(List<DailyAggregate> rows) {
        Map<KpiMetric, Double> sums = new EnumMap<>(KpiMetric.class);
        for (KpiMetric metric : KpiMetric.values()) {
            double sum = 0.0;
            for (DailyAggregate row : rows) {
                sum += metric.valueOf(row);
            }
            sums.put(metric, sum);
        }
        return sums;
    }

    /**
     * KPI metric -> mean over the rows; empty map for no rows.
     */
    private static Map<String, Double> averages(List<DailyAggregate> rows) {
        Map<String, Double> averages = new LinkedHashMap<>();
        if (rows.isEmpty()) return averages;

        for (KpiMetric metric : KpiMetric.values()) {
            double sum = 0.0;
            for (DailyAggregate row : rows) {
                sum += metric.valueOf(row);
            }
            averages.put(metric.getKey(), sum / rows.size());
        }
        return averages;
    }
}
