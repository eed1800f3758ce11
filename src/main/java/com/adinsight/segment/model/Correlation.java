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
@Schema(description = "Two metrics whose anomalies move together or oppositely within the same campaign and day")
public class Correlation {

    @Schema(description = "First metric (alphabetical)", example = "conversions")
    private String metric1;

    @Schema(description = "Second metric (alphabetical)", example = "ctr")
    private String metric2;

    @Schema(description = "Direction of the relationship", example = "positive")
    private CorrelationType correlationType;

    @Schema(description = "Share of paired samples agreeing with the direction (0-1)", example = "1.0")
    private double strength;

    @Schema(description = "Number of campaign-day samples the pair co-occurred in", example = "2")
    private int sampleCount;

    @Schema(description = "Human-readable explanation")
    private String description;
}
