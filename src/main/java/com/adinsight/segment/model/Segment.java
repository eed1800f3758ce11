package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies grouped under one segment key (a campaign), with its severity ranking score")
public class Segment {

    @Schema(description = "Grouping key (campaign id)", example = "campaign-1")
    private String key;

    @Schema(description = "Display name (campaign name, falling back to the key)", example = "Spring Sale")
    private String name;

    @Schema(description = "Number of anomalies in the segment", example = "3")
    private int anomalyCount;

    @Schema(description = "Sum of severity weights (critical=3, warning=2, info=1). Ranking key.", example = "7")
    private int severityScore;

    @Schema(description = "Mean severity weight", example = "2.33")
    private double avgSeverityScore;

    @Schema(description = "Most frequent anomaly type", example = "spike")
    private AnomalyType dominantType;

    @Schema(description = "Metric with the most anomalies", example = "ctr")
    private String mostAffectedMetric;

    @Schema(description = "Weekday / weekend / per-day counts of detection times")
    private TimeDistribution timeDistribution;

    @Schema(description = "Anomalies belonging to this segment, in input order")
    private List<Anomaly> anomalies;
}
