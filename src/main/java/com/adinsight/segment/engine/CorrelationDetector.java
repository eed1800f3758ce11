package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Correlation;
import com.adinsight.segment.model.CorrelationType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds metric pairs whose anomalies move in the same or opposite direction
 * within the same campaign on the same calendar day.
 *
 * Each campaign-day bucket contributes at most one sample per metric pair;
 * a metric's direction in the bucket is the sign of its summed changePercent.
 * Pairs seen in fewer than minSamples buckets are not reported.
 */
@Component
public class CorrelationDetector {

    private final SegmentAnalysisConfig config;
    private final TimePatternDetector timePatternDetector;

    public CorrelationDetector(SegmentAnalysisConfig config, TimePatternDetector timePatternDetector) {
        this.config = config;
        this.timePatternDetector = timePatternDetector;
    }

    public List<Correlation> detect(List<Anomaly> anomalies) {
        ZoneId zone = timePatternDetector.zone();

        // (campaign, day) -> metric -> summed changePercent
        Map<BucketKey, Map<String, Double>> buckets = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            LocalDate day = anomaly.getDetectedAt().atZone(zone).toLocalDate();
            BucketKey bucketKey = new BucketKey(anomaly.getCampaignId(), day);
            buckets.computeIfAbsent(bucketKey, k -> new LinkedHashMap<>())
                    .merge(anomaly.getMetric(), anomaly.getChangePercent(), Double::sum);
        }

        Map<PairKey, PairTally> tallies = new LinkedHashMap<>();
        for (Map<String, Double> bucket : buckets.values()) {
            if (bucket.size() < 2) continue;

            List<Map.Entry<String, Double>> entries = new ArrayList<>(bucket.entrySet());
            for (int i = 0; i < entries.size(); i++) {
                for (int j = i + 1; j < entries.size(); j++) {
                    String m1 = entries.get(i).getKey();
                    String m2 = entries.get(j).getKey();
                    String first = m1.compareTo(m2) <= 0 ? m1 : m2;
                    String second = first.equals(m1) ? m2 : m1;

                    PairTally tally = tallies.computeIfAbsent(new PairKey(first, second), k -> new PairTally(first, second));
                    tally.record(Math.signum(entries.get(i).getValue()), Math.signum(entries.get(j).getValue()));
                }
            }
        }

        SegmentAnalysisConfig.Correlation thresholds = config.getCorrelation();
        List<Correlation> correlations = new ArrayList<>();
        for (PairTally tally : tallies.values()) {
            if (tally.total < thresholds.getMinSamples()) continue;

            double agreeingShare = (double) tally.agreeing / tally.total;
            double opposingShare = (double) tally.opposing / tally.total;

            if (agreeingShare > thresholds.getDirectionRatio()) {
                correlations.add(toCorrelation(tally, CorrelationType.POSITIVE, agreeingShare));
            } else if (opposingShare > thresholds.getDirectionRatio()) {
                correlations.add(toCorrelation(tally, CorrelationType.NEGATIVE, opposingShare));
            }
        }

        correlations.sort(Comparator.comparingDouble(Correlation::getStrength).reversed());
        return correlations;
    }

    private Correlation toCorrelation(PairTally tally, CorrelationType type, double strength) {
        return Correlation.builder()
                .metric1(tally.metric1)
                .metric2(tally.metric2)
                .correlationType(type)
                .strength(strength)
                .sampleCount(tally.total)
                .description(describe(tally.metric1, tally.metric2, type))
                .build();
    }

    private static String describe(String metric1, String metric2, CorrelationType type) {
        if (type == CorrelationType.POSITIVE) {
            return String.format("%s and %s tend to move together. An anomaly in one is likely to show up in the other.",
                    metric1, metric2);
        }
        return String.format("%s and %s move in opposite directions. When one rises, the other tends to fall.",
                metric1, metric2);
    }

    private record BucketKey(String campaignId, LocalDate day) {
    }

    private record PairKey(String first, String second) {
    }

    private static final class PairTally {
        private final String metric1;
        private final String metric2;
        private int agreeing;
        private int opposing;
        private int total;

        private PairTally(String metric1, String metric2) {
            this.metric1 = metric1;
            this.metric2 = metric2;
        }

        private void record(double sign1, double sign2) {
            total++;
            double product = sign1 * sign2;
            if (product > 0) {
                agreeing++;
            } else if (product < 0) {
                opposing++;
            }
        }
    }
}
