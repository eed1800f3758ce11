package com.adinsight.segment.controller;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.exception.InvalidAnalysisInputException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify analysis thresholds at runtime")
public class ConfigController {

    private final SegmentAnalysisConfig config;

    public ConfigController(SegmentAnalysisConfig config) {
        this.config = config;
    }

    @Operation(summary = "Get analysis thresholds")
    @GetMapping("/thresholds")
    public ResponseEntity<Map<String, Object>> getThresholds() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timeZone", config.getTimeZone());
        body.put("weekdaySpikeRatio", config.getTimePatterns().getWeekdaySpikeRatio());
        body.put("weekendSpikeRatio", config.getTimePatterns().getWeekendSpikeRatio());
        body.put("periodicDayRatio", config.getTimePatterns().getPeriodicDayRatio());
        body.put("kpiDeviationRatio", config.getTimePatterns().getKpiDeviationRatio());
        body.put("correlationMinSamples", config.getCorrelation().getMinSamples());
        body.put("correlationDirectionRatio", config.getCorrelation().getDirectionRatio());
        body.put("propagationWindowHours", config.getPropagation().getWindowHours());
        body.put("highRiskCriticalCount", config.getInsights().getHighRiskCriticalCount());
        body.put("metricConcentrationRatio", config.getInsights().getMetricConcentrationRatio());
        body.put("timePatternMinConfidence", config.getInsights().getTimePatternMinConfidence());
        body.put("healthScoreBase", config.getHealthScore().getBase());
        body.put("healthScorePerAnomalyPenalty", config.getHealthScore().getPerAnomalyPenalty());
        body.put("healthScorePerSeverityPenalty", config.getHealthScore().getPerSeverityPenalty());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update analysis thresholds",
            description = "Only the keys present in the body change. A value that is not a number is rejected. " +
                    "Changes apply immediately but reset on restart.")
    @PutMapping("/thresholds")
    public ResponseEntity<?> updateThresholds(@RequestBody Map<String, Object> body) {
        SegmentAnalysisConfig.TimePatterns timePatterns = config.getTimePatterns();
        SegmentAnalysisConfig.Insights insights = config.getInsights();
        SegmentAnalysisConfig.HealthScore healthScore = config.getHealthScore();

        String zone = body.containsKey("timeZone") ? String.valueOf(body.get("timeZone")) : config.getTimeZone();
        double weekday, weekend, periodic, kpi, direction, concentration, minConfidence;
        double base, perAnomaly, perSeverity;
        int minSamples, criticalCount;
        long windowHours;
        try {
            weekday = toDouble(body, "weekdaySpikeRatio", timePatterns.getWeekdaySpikeRatio());
            weekend = toDouble(body, "weekendSpikeRatio", timePatterns.getWeekendSpikeRatio());
            periodic = toDouble(body, "periodicDayRatio", timePatterns.getPeriodicDayRatio());
            kpi = toDouble(body, "kpiDeviationRatio", timePatterns.getKpiDeviationRatio());
            minSamples = toInt(body, "correlationMinSamples", config.getCorrelation().getMinSamples());
            direction = toDouble(body, "correlationDirectionRatio", config.getCorrelation().getDirectionRatio());
            windowHours = toLong(body, "propagationWindowHours", config.getPropagation().getWindowHours());
            criticalCount = toInt(body, "highRiskCriticalCount", insights.getHighRiskCriticalCount());
            concentration = toDouble(body, "metricConcentrationRatio", insights.getMetricConcentrationRatio());
            minConfidence = toDouble(body, "timePatternMinConfidence", insights.getTimePatternMinConfidence());
            base = toDouble(body, "healthScoreBase", healthScore.getBase());
            perAnomaly = toDouble(body, "healthScorePerAnomalyPenalty", healthScore.getPerAnomalyPenalty());
            perSeverity = toDouble(body, "healthScorePerSeverityPenalty", healthScore.getPerSeverityPenalty());
        } catch (InvalidAnalysisInputException e) {
            return badRequest(e.getMessage(), e.getField());
        }

        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            return badRequest("timeZone is not a valid zone id: " + zone, "timeZone");
        }
        if (weekday <= 0.5 || weekday > 1) return badRequest("weekdaySpikeRatio must be in (0.5, 1]", "weekdaySpikeRatio");
        if (weekend <= 0.5 || weekend > 1) return badRequest("weekendSpikeRatio must be in (0.5, 1]", "weekendSpikeRatio");
        if (periodic <= 0 || periodic > 1) return badRequest("periodicDayRatio must be in (0, 1]", "periodicDayRatio");
        if (kpi <= 0) return badRequest("kpiDeviationRatio must be > 0", "kpiDeviationRatio");
        if (minSamples < 1) return badRequest("correlationMinSamples must be >= 1", "correlationMinSamples");
        if (direction < 0.5 || direction >= 1) return badRequest("correlationDirectionRatio must be in [0.5, 1)", "correlationDirectionRatio");
        if (windowHours <= 0) return badRequest("propagationWindowHours must be > 0", "propagationWindowHours");
        if (criticalCount < 1) return badRequest("highRiskCriticalCount must be >= 1", "highRiskCriticalCount");
        if (concentration <= 0 || concentration >= 1) return badRequest("metricConcentrationRatio must be in (0, 1)", "metricConcentrationRatio");
        if (minConfidence < 0 || minConfidence >= 1) return badRequest("timePatternMinConfidence must be in [0, 1)", "timePatternMinConfidence");
        if (base <= 0 || base > 100) return badRequest("healthScoreBase must be in (0, 100]", "healthScoreBase");
        if (perAnomaly < 0) return badRequest("healthScorePerAnomalyPenalty must be >= 0", "healthScorePerAnomalyPenalty");
        if (perSeverity < 0) return badRequest("healthScorePerSeverityPenalty must be >= 0", "healthScorePerSeverityPenalty");

        config.setTimeZone(zone);
        timePatterns.setWeekdaySpikeRatio(weekday);
        timePatterns.setWeekendSpikeRatio(weekend);
        timePatterns.setPeriodicDayRatio(periodic);
        timePatterns.setKpiDeviationRatio(kpi);
        config.getCorrelation().setMinSamples(minSamples);
        config.getCorrelation().setDirectionRatio(direction);
        config.getPropagation().setWindowHours(windowHours);
        insights.setHighRiskCriticalCount(criticalCount);
        insights.setMetricConcentrationRatio(concentration);
        insights.setTimePatternMinConfidence(minConfidence);
        healthScore.setBase(base);
        healthScore.setPerAnomalyPenalty(perAnomaly);
        healthScore.setPerSeverityPenalty(perSeverity);

        return getThresholds();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { throw notANumber(key, v); }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { throw notANumber(key, v); }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { throw notANumber(key, v); }
    }

    private static InvalidAnalysisInputException notANumber(String key, Object value) {
        return new InvalidAnalysisInputException(key + " must be a number, got: " + value, key);
    }
}
