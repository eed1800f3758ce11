package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.Segment;
import com.adinsight.segment.model.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fires when at least one campaign has accumulated highRiskCriticalCount or more critical anomalies.
 */
@Component
@Order(1)
public class HighRiskCampaignRule implements InsightRule {

    static final String ID = "high-risk-campaigns";

    private final SegmentAnalysisConfig config;

    public HighRiskCampaignRule(SegmentAnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getInsightId() {
        return ID;
    }

    @Override
    public Optional<Insight> evaluate(InsightContext context) {
        int threshold = config.getInsights().getHighRiskCriticalCount();

        List<String> highRisk = new ArrayList<>();
        int criticalTotal = 0;
        for (Segment segment : context.getSegments()) {
            long critical = segment.getAnomalies().stream()
                    .map(Anomaly::getSeverity)
                    .filter(s -> s == Severity.CRITICAL)
                    .count();
            if (critical >= threshold) {
                highRisk.add(segment.getName());
                criticalTotal += (int) critical;
            }
        }

        if (highRisk.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Insight.builder()
                .id(ID)
                .type(InsightType.WARNING)
                .title("High-risk campaigns detected")
                .description(String.format("%d campaign(s) have %d critical anomalies between them: %s. "
                        + "Immediate review is recommended.", highRisk.size(), criticalTotal, String.join(", ", highRisk)))
                .confidence(0.9)
                .relatedSegments(highRisk)
                .actionItems(List.of(
                        "Check recent setting changes on these campaigns",
                        "Review budget and targeting settings",
                        "Monitor competitor activity"))
                .build());
    }
}
