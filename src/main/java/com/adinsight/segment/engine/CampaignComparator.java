package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.CampaignComparison;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a per-campaign comparison with a 0-100 health score and sorts it
 * most at-risk first.
 *
 * healthScore = max(0, base - anomalyCount * perAnomalyPenalty - avgSeverity * perSeverityPenalty),
 * with the defaults base=100, perAnomalyPenalty=10, perSeverityPenalty=15.
 */
@Component
public class CampaignComparator {

    private final SegmentAnalysisConfig config;

    public CampaignComparator(SegmentAnalysisConfig config) {
        this.config = config;
    }

    public List<CampaignComparison> compare(List<Anomaly> anomalies) {
        List<CampaignComparison> comparisons = new ArrayList<>();

        for (Map.Entry<String, List<Anomaly>> entry : SegmentBuilder.groupByCampaign(anomalies).entrySet()) {
            List<Anomaly> campaignAnomalies = entry.getValue();

            // metric -> [count, changeSum]
            Map<String, double[]> metricTotals = new LinkedHashMap<>();
            double severitySum = 0.0;
            for (Anomaly anomaly : campaignAnomalies) {
                severitySum += anomaly.getSeverity().getWeight();
                double[] totals = metricTotals.computeIfAbsent(anomaly.getMetric(), k -> new double[2]);
                totals[0]++;
                totals[1] += anomaly.getChangePercent();
            }

            Map<String, CampaignComparison.MetricChange> metrics = new LinkedHashMap<>();
            metricTotals.forEach((metric, totals) -> metrics.put(metric, CampaignComparison.MetricChange.builder()
                    .anomalyCount((int) totals[0])
                    .avgChange(Frequencies.mean(totals[1], (int) totals[0]))
                    .build()));

            int count = campaignAnomalies.size();
            double avgSeverity = Frequencies.mean(severitySum, count);

            comparisons.add(CampaignComparison.builder()
                    .campaignId(entry.getKey())
                    .campaignName(SegmentBuilder.displayName(entry.getKey(), campaignAnomalies))
                    .anomalyCount(count)
                    .avgSeverity(avgSeverity)
                    .dominantAnomalyType(Frequencies.mostFrequent(campaignAnomalies, Anomaly::getType))
                    .healthScore(healthScore(count, avgSeverity))
                    .metrics(metrics)
                    .build());
        }

        comparisons.sort(Comparator.comparingDouble(CampaignComparison::getHealthScore)
                .thenComparing(CampaignComparison::getCampaignName));
        return comparisons;
    }

    double healthScore(int anomalyCount, double avgSeverity) {
        SegmentAnalysisConfig.HealthScore weights = config.getHealthScore();
        double raw = weights.getBase()
                - anomalyCount * weights.getPerAnomalyPenalty()
                - avgSeverity * weights.getPerSeverityPenalty();
        return Math.max(0.0, Math.min(100.0, raw));
    }
}
