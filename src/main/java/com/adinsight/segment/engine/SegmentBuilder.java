package com.adinsight.segment.engine;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Segment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups anomalies into one segment per campaign and ranks the segments
 * by summed severity weight, highest first. Ties keep first-seen order.
 */
@Component
public class SegmentBuilder {

    private final TimePatternDetector timePatternDetector;

    public SegmentBuilder(TimePatternDetector timePatternDetector) {
        this.timePatternDetector = timePatternDetector;
    }

    public List<Segment> buildSegments(List<Anomaly> anomalies) {
        Map<String, List<Anomaly>> byCampaign = groupByCampaign(anomalies);

        List<Segment> segments = new ArrayList<>(byCampaign.size());
        for (Map.Entry<String, List<Anomaly>> entry : byCampaign.entrySet()) {
            List<Anomaly> campaignAnomalies = entry.getValue();

            int severityScore = 0;
            for (Anomaly anomaly : campaignAnomalies) {
                severityScore += anomaly.getSeverity().getWeight();
            }

            segments.add(Segment.builder()
                    .key(entry.getKey())
                    .name(displayName(entry.getKey(), campaignAnomalies))
                    .anomalyCount(campaignAnomalies.size())
                    .severityScore(severityScore)
                    .avgSeverityScore(Frequencies.mean(severityScore, campaignAnomalies.size()))
                    .dominantType(Frequencies.mostFrequent(campaignAnomalies, Anomaly::getType))
                    .mostAffectedMetric(Frequencies.mostFrequent(campaignAnomalies, Anomaly::getMetric))
                    .timeDistribution(timePatternDetector.distributionOf(campaignAnomalies))
                    .anomalies(List.copyOf(campaignAnomalies))
                    .build());
        }

        // List.sort is stable, so equal scores stay in first-seen order
        segments.sort(Comparator.comparingInt(Segment::getSeverityScore).reversed());
        return segments;
    }

    /**
     * Campaign id -> anomalies, in order of first appearance.
     */
    public static Map<String, List<Anomaly>> groupByCampaign(List<Anomaly> anomalies) {
        Map<String, List<Anomaly>> byCampaign = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            byCampaign.computeIfAbsent(anomaly.getCampaignId(), k -> new ArrayList<>()).add(anomaly);
        }
        return byCampaign;
    }

    static String displayName(String campaignId, List<Anomaly> campaignAnomalies) {
        String name = campaignAnomalies.get(0).getCampaignName();
        return name != null && !name.isBlank() ? name : campaignId;
    }
}
