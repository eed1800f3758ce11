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
@Schema(description = "Baseline statistics the upstream detector compared the current value against")
public class StatisticalBaseline {
    private double mean;
    private double stdDev;
    private double median;
    private double q1;
    private double q3;
    private double iqr;
    private double min;
    private double max;
    private double percentile95;
    private int sampleSize;
}
