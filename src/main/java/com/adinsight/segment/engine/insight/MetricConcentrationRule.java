package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.engine.Frequencies;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Fires when a single metric accounts for more than metricConcentrationRatio of all anomalies.
 */
@Component
@Order(2)
public class MetricConcentrationRule implements InsightRule {

    static final String ID = "metric-concentration";

    private final SegmentAnalysisConfig config;

    public MetricConcentrationRule(SegmentAnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getInsightId() {
        return ID;
    }

    @Override
    public Optional<Insight> evaluate(InsightContext context) {
        List<Anomaly> anomalies = context.getAnomalies();
        if (anomalies.isEmpty()) {
            return Optional.empty();
        }

        String topMetric = Frequencies.mostFrequent(anomalies, Anomaly::getMetric);
        long topCount = anomalies.stream().filter(a -> topMetric.equals(a.getMetric())).count();
        double share = (double) topCount / anomalies.size();

        if (share <= config.getInsights().getMetricConcentrationRatio()) {
            return Optional.empty();
        }

        return Optional.of(Insight.builder()
                .id(ID)
                .type(InsightType.INFO)
                .title(String.format("Anomalies concentrated in %s", topMetric))
                .description(String.format("%d%% of all anomalies (%d of %d) occurred in the %s metric.",
                        Math.round(share * 100), topCount, anomalies.size(), topMetric))
                .confidence(share)
                .actionItems(List.of(
                        String.format("Review every setting that affects %s", topMetric),
                        "Check how related metrics moved alongside it"))
                .build());
    }
}
