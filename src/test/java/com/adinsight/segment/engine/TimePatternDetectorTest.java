package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.TimePattern;
import com.adinsight.segment.model.TimePatternResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.adinsight.segment.testutil.TestDataFactory.MONDAY;
import static com.adinsight.segment.testutil.TestDataFactory.anomaly;
import static com.adinsight.segment.testutil.TestDataFactory.at;
import static org.assertj.core.api.Assertions.assertThat;

class TimePatternDetectorTest {

    private SegmentAnalysisConfig config;
    private TimePatternDetector detector;

    @BeforeEach
    void setUp() {
        config = new SegmentAnalysisConfig();
        detector = new TimePatternDetector(config);
    }

    @Test
    void detect_weekdaysOnly_returnsWeekdaySpike() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            LocalDate day = MONDAY.plusDays(i);
            if (day.getDayOfWeek().getValue() <= 5) {
                anomalies.add(anomaly().detectedAt(at(day)).build());
            }
        }

        TimePatternResult result = detector.detect(anomalies);

        assertThat(result.getPattern()).isEqualTo(TimePattern.WEEKDAY_SPIKE);
        assertThat(result.getConfidence()).isGreaterThan(0.7);
        assertThat(result.getDetails()).contains("weekday");
        assertThat(result.getRecommendedMonitoring()).isNotEmpty();
    }

    @Test
    void detect_weekendsOnly_returnsWeekendSpike() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int week = 0; week < 4; week++) {
            anomalies.add(anomaly().detectedAt(at(MONDAY.plusDays(5 + week * 7L))).build());
            anomalies.add(anomaly().detectedAt(at(MONDAY.plusDays(6 + week * 7L))).build());
        }

        TimePatternResult result = detector.detect(anomalies);

        assertThat(result.getPattern()).isEqualTo(TimePattern.WEEKEND_SPIKE);
        assertThat(result.getConfidence()).isGreaterThan(0.7);
        assertThat(result.getDetails()).contains("weekend");
    }

    @Test
    void detect_evenlySpreadOverWeek_returnsConsistent() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            anomalies.add(anomaly().detectedAt(at(MONDAY.plusDays(i))).build());
        }

        TimePatternResult result = detector.detect(anomalies);

        assertThat(result.getPattern()).isEqualTo(TimePattern.CONSISTENT);
        assertThat(result.getRecommendedMonitoring()).isNotEmpty();
        assertThat(result.getDistribution().getWeekday()).isEqualTo(5);
        assertThat(result.getDistribution().getWeekend()).isEqualTo(2);
    }

    @Test
    void detect_oneDayDominatesMixedWeek_returnsPeriodic() {
        // 3 Saturdays + 2 weekdays: weekend share 0.6, Saturday share 0.6
        List<Anomaly> anomalies = List.of(
                anomaly().detectedAt(at(MONDAY.plusDays(5))).build(),
                anomaly().detectedAt(at(MONDAY.plusDays(12))).build(),
                anomaly().detectedAt(at(MONDAY.plusDays(19))).build(),
                anomaly().detectedAt(at(MONDAY)).build(),
                anomaly().detectedAt(at(MONDAY.plusDays(2))).build());

        TimePatternResult result = detector.detect(anomalies);

        assertThat(result.getPattern()).isEqualTo(TimePattern.PERIODIC);
        assertThat(result.getConfidence()).isEqualTo(0.6);
        assertThat(result.getDetails()).contains("Saturday");
    }

    @Test
    void detect_emptyInput_isConsistentWithZeroConfidence() {
        TimePatternResult result = detector.detect(Collections.emptyList());

        assertThat(result.getPattern()).isEqualTo(TimePattern.CONSISTENT);
        assertThat(result.getConfidence()).isEqualTo(0.0);
        assertThat(result.getRecommendedMonitoring()).isNotEmpty();
    }

    @Test
    void detect_usesConfiguredTimeZoneForDayBoundaries() {
        // 2025-01-05T20:00Z is Sunday in UTC but Monday 05:00 in Seoul
        Anomaly lateSunday = anomaly().detectedAt(Instant.parse("2025-01-05T20:00:00Z")).build();

        assertThat(detector.detect(List.of(lateSunday)).getPattern()).isEqualTo(TimePattern.WEEKEND_SPIKE);

        config.setTimeZone("Asia/Seoul");
        assertThat(detector.detect(List.of(lateSunday)).getPattern()).isEqualTo(TimePattern.WEEKDAY_SPIKE);
    }

    @Test
    void detect_defaultZone_keepsUtcEveningOnTheSameWeekday() {
        // Monday to Friday at 22:00 UTC
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            anomalies.add(anomaly().detectedAt(MONDAY.plusDays(i).atTime(22, 0).toInstant(ZoneOffset.UTC)).build());
        }

        TimePatternResult result = detector.detect(anomalies);

        assertThat(config.getTimeZone()).isEqualTo("UTC");
        assertThat(result.getPattern()).isEqualTo(TimePattern.WEEKDAY_SPIKE);
        assertThat(result.getDistribution().getWeekend()).isZero();
    }

    @Test
    void detect_sameInputTwice_returnsEqualResults() {
        List<Anomaly> anomalies = List.of(
                anomaly().detectedAt(at(MONDAY)).build(),
                anomaly().detectedAt(at(MONDAY.plusDays(3))).build());

        assertThat(detector.detect(anomalies)).isEqualTo(detector.detect(anomalies));
    }
}
