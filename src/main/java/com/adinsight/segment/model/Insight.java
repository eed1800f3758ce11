package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Natural-language finding derived from the segment analysis")
public class Insight {

    @Schema(description = "Stable insight identifier", example = "high-risk-campaigns")
    private String id;

    @Schema(description = "Insight type", example = "warning")
    private InsightType type;

    @Schema(description = "Short title", example = "High-risk campaigns detected")
    private String title;

    @Schema(description = "Full description, renderable as-is")
    private String description;

    @Schema(description = "Confidence (0-1)", example = "0.9")
    private double confidence;

    @Schema(description = "Names of the segments the insight refers to")
    @Builder.Default
    private List<String> relatedSegments = new ArrayList<>();

    @Schema(description = "Concrete follow-up actions, when the insight has any")
    private List<String> actionItems;
}
