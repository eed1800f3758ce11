package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomaly summary for one metric category")
public class MetricCategoryResult {

    @Schema(description = "Category", example = "spend_related")
    private MetricCategory category;

    @Schema(description = "Category label", example = "Spend")
    private String displayName;

    @Schema(description = "Number of anomalies in the category", example = "2")
    private int anomalyCount;

    @Schema(description = "Mean severity weight", example = "2.5")
    private double avgSeverityScore;

    @Schema(description = "Most frequent anomaly type (first seen wins ties)", example = "spike")
    private AnomalyType dominantType;

    @Schema(description = "Metric with the most anomalies in the category", example = "cpa")
    private String mostAffectedMetric;
}
