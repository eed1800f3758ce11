package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A performance anomaly already detected for a campaign metric")
public class Anomaly {

    @Schema(description = "Unique anomaly identifier", example = "anomaly-3f9a2c")
    private String id;

    @Schema(description = "Campaign identifier", example = "campaign-1")
    private String campaignId;

    @Schema(description = "Campaign display name", example = "Spring Sale - Retargeting")
    private String campaignName;

    @Schema(description = "Anomaly type", example = "spike")
    private AnomalyType type;

    @Schema(description = "Severity assigned by the detector", example = "warning")
    private Severity severity;

    @Schema(description = "Metric name", example = "ctr")
    private String metric;

    @Schema(description = "Metric value in the current period", example = "3.5")
    private double currentValue;

    @Schema(description = "Metric value in the comparison period", example = "2.0")
    private double previousValue;

    @Schema(description = "Signed change from previous to current value (%)", example = "75.0")
    private Double changePercent;

    @Schema(description = "Human-readable summary from the detector", example = "CTR rose 75%")
    private String message;

    @Schema(description = "Detection timestamp (ISO-8601)", example = "2025-01-06T09:00:00Z")
    private Instant detectedAt;

    @Schema(description = "Detection method and baseline statistics")
    private AnomalyDetail detail;

    @Schema(description = "Detector recommendations, in priority order")
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();
}
