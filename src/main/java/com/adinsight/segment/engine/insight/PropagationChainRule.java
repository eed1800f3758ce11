package com.adinsight.segment.engine.insight;

import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.PropagationPath;
import com.adinsight.segment.model.Severity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Explains the propagation path, when one was found.
 */
@Component
@Order(4)
public class PropagationChainRule implements InsightRule {

    static final String ID = "propagation-chain";

    @Override
    public String getInsightId() {
        return ID;
    }

    @Override
    public Optional<Insight> evaluate(InsightContext context) {
        PropagationPath path = context.getPropagationPath();
        if (path == null) {
            return Optional.empty();
        }

        String campaign = path.getRootAnomaly().getCampaignName() != null
                ? path.getRootAnomaly().getCampaignName()
                : path.getRootAnomaly().getCampaignId();
        String root = path.getRootAnomaly().getMetric();

        return Optional.of(Insight.builder()
                .id(ID)
                .type(InsightType.WARNING)
                .title(String.format("%s anomaly may have propagated", root))
                .description(String.format("In %s, a %s anomaly was followed by %d related anomalies: %s.",
                        campaign, root, path.getPropagatedAnomalies().size(),
                        String.join(" -> ", path.getPropagationChain())))
                .confidence(path.getImpactScore() / Severity.CRITICAL.getWeight())
                .relatedSegments(List.of(campaign))
                .actionItems(List.of(
                        String.format("Investigate the %s change first", root),
                        "Re-check downstream metrics once the root cause is fixed"))
                .build());
    }
}
