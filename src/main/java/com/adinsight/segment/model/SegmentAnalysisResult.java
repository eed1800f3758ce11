package com.adinsight.segment.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Full segment analysis of an anomaly set")
public class SegmentAnalysisResult {

    @Schema(description = "How anomalies were segmented", example = "campaign")
    private SegmentType segmentType;

    @Schema(description = "Segments ranked by severity score, highest first")
    private List<Segment> segments;

    @Schema(description = "Insights ranked warnings first")
    private List<Insight> insights;

    @Schema(description = "Metric pairs that move together or oppositely")
    private List<Correlation> correlations;

    @Schema(description = "First propagation cluster found; absent when none qualifies")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private PropagationPath propagationPath;

    @Schema(description = "Campaign comparison, most at-risk first")
    private List<CampaignComparison> campaignComparisons;

    @Schema(description = "Per-category summary")
    private Map<MetricCategory, MetricCategoryResult> metricCategories;

    @Schema(description = "Time pattern of the anomaly set")
    private TimePatternResult timePattern;
}
