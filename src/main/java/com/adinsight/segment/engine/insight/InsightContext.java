package com.adinsight.segment.engine.insight;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.CampaignComparison;
import com.adinsight.segment.model.Correlation;
import com.adinsight.segment.model.MetricCategory;
import com.adinsight.segment.model.MetricCategoryResult;
import com.adinsight.segment.model.PropagationPath;
import com.adinsight.segment.model.Segment;
import com.adinsight.segment.model.TimePatternResult;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Everything the orchestrator already computed, handed to each insight rule
 * so no rule recomputes another analyzer's output.
 */
@Data
@Builder
public class InsightContext {
    private List<Anomaly> anomalies;
    private List<Segment> segments;
    private List<CampaignComparison> campaignComparisons;
    private Map<MetricCategory, MetricCategoryResult> metricCategories;
    private List<Correlation> correlations;
    private TimePatternResult timePattern;

    // null when no propagation cluster was found
    private PropagationPath propagationPath;
}
