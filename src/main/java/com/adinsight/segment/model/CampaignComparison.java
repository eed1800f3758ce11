package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-campaign anomaly comparison with a 0-100 health score")
public class CampaignComparison {

    @Schema(description = "Campaign identifier", example = "campaign-1")
    private String campaignId;

    @Schema(description = "Campaign display name", example = "Spring Sale")
    private String campaignName;

    @Schema(description = "Number of anomalies", example = "3")
    private int anomalyCount;

    @Schema(description = "Mean severity weight, unrounded", example = "3.0")
    private double avgSeverity;

    @Schema(description = "Most frequent anomaly type", example = "spike")
    private AnomalyType dominantAnomalyType;

    @Schema(description = "max(0, 100 - anomalyCount*10 - avgSeverity*15). Lower is worse.", example = "25.0")
    private double healthScore;

    @Schema(description = "Per-metric anomaly count and mean signed change")
    private Map<String, MetricChange> metrics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricChange {
        private int anomalyCount;
        private double avgChange;
    }
}
