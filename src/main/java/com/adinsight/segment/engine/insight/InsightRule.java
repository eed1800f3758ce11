package com.adinsight.segment.engine.insight;

import com.adinsight.segment.model.Insight;

import java.util.Optional;

/**
 * One insight rule. Each implementation produces at most one insight with a fixed id.
 */
public interface InsightRule {

    /**
     * Stable identifier of the insight this rule produces, e.g. "high-risk-campaigns".
     */
    String getInsightId();

    /**
     * Evaluate the rule against the computed analyses.
     *
     * @param context segments, comparisons, categories, correlations, time pattern and propagation path
     * @return the insight when the rule fires, empty otherwise
     */
    Optional<Insight> evaluate(InsightContext context);
}
