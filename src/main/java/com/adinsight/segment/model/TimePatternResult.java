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
@Schema(description = "Weekday/weekend classification of anomaly detection times")
public class TimePatternResult {

    @Schema(description = "Detected pattern", example = "weekday_spike")
    private TimePattern pattern;

    @Schema(description = "Confidence in the pattern (0-1)", example = "0.9")
    private double confidence;

    @Schema(description = "Explanation naming the dominant period",
            example = "Anomalies are concentrated on weekdays (9 of 10). This often tracks business-hours activity.")
    private String details;

    @Schema(description = "Follow-up monitoring actions, never empty")
    private List<String> recommendedMonitoring;

    @Schema(description = "Counts the pattern was derived from")
    private TimeDistribution distribution;
}
