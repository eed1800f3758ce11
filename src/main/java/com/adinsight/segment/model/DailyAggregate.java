package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "KPI totals for one calendar day")
public class DailyAggregate {

    @Schema(description = "Calendar day", example = "2025-01-06")
    private LocalDate date;

    @Schema(example = "10000")
    private long totalImpressions;

    @Schema(example = "500")
    private long totalClicks;

    @Schema(example = "50")
    private long totalConversions;

    @Schema(example = "100000.0")
    private double totalSpend;

    @Schema(example = "500000.0")
    private double totalRevenue;
}
