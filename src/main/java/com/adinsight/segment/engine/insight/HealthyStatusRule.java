package com.adinsight.segment.engine.insight;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fires when nothing above info severity was detected, including an empty anomaly set.
 */
@Component
@Order(5)
public class HealthyStatusRule implements InsightRule {

    static final String ID = "healthy-status";

    @Override
    public String getInsightId() {
        return ID;
    }

    @Override
    public Optional<Insight> evaluate(InsightContext context) {
        boolean anySerious = context.getAnomalies().stream()
                .map(Anomaly::getSeverity)
                .anyMatch(Severity::isAboveInfo);
        if (anySerious) {
            return Optional.empty();
        }

        return Optional.of(Insight.builder()
                .id(ID)
                .type(InsightType.RECOMMENDATION)
                .title("Overall status is healthy")
                .description("Campaigns are running normally; only informational anomalies were found. "
                        + "Keep the current settings and continue regular monitoring.")
                .confidence(0.8)
                .build());
    }
}
