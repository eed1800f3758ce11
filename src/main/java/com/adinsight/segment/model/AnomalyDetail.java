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
@Schema(description = "How the upstream detector found the anomaly")
public class AnomalyDetail {

    @Schema(description = "Detection method", example = "zscore")
    private DetectionMethod detectionMethod;

    @Schema(description = "Z-score of the current value against the baseline", example = "2.8")
    private Double zscore;

    @Schema(description = "Distance outside the IQR fences, in IQR units", example = "1.4")
    private Double iqrDistance;

    @Schema(description = "Deviation from the moving average (%)", example = "35.0")
    private Double movingAverageDeviation;

    @Schema(description = "Baseline statistics")
    private StatisticalBaseline baseline;

    @Schema(description = "Trend of the metric over the baseline window", example = "stable")
    private HistoricalTrend historicalTrend;
}
