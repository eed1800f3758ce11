package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Day-of-week KPI baselines and the days that deviate from their own weekday baseline")
public class KpiTimePatternResult {

    @Schema(description = "KPI metric -> mean over weekday rows (empty without weekday rows)")
    private Map<String, Double> weekdayAvg;

    @Schema(description = "KPI metric -> mean over weekend rows (empty without weekend rows)")
    private Map<String, Double> weekendAvg;

    @Schema(description = "Day of week -> KPI metric -> mean. Days without rows are omitted.")
    private Map<DayOfWeek, Map<String, Double>> dayOfWeekAvg;

    @Schema(description = "Dates where a KPI deviates more than the configured ratio from its day-of-week mean")
    private List<LocalDate> anomalyDays;
}
