package com.adinsight.segment.controller;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.CampaignComparison;
import com.adinsight.segment.model.DailyAggregate;
import com.adinsight.segment.model.KpiTimePatternResult;
import com.adinsight.segment.model.MetricCategory;
import com.adinsight.segment.model.MetricCategoryResult;
import com.adinsight.segment.model.SegmentAnalysisResult;
import com.adinsight.segment.model.TimePatternResult;
import com.adinsight.segment.service.SegmentAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/segments")
@Tag(name = "Segment Analysis", description = "Segment, compare and explain already-detected campaign anomalies")
public class SegmentAnalysisController {

    private final SegmentAnalysisService analysisService;

    public SegmentAnalysisController(SegmentAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Operation(summary = "Run the full segment analysis",
            description = "Groups anomalies per campaign and ranks the segments by summed severity weight. " +
                    "Also returns insights, metric correlations and the first propagation path found.")
    @PostMapping("/analyze")
    public ResponseEntity<SegmentAnalysisResult> analyzeSegments(@RequestBody List<Anomaly> anomalies) {
        return ResponseEntity.ok(analysisService.analyzeSegments(anomalies));
    }

    @Operation(summary = "Compare campaigns",
            description = "Per-campaign anomaly count, average severity, per-metric change and 0-100 health score, " +
                    "most at-risk campaign first.")
    @PostMapping("/campaigns/compare")
    public ResponseEntity<List<CampaignComparison>> compareCampaigns(@RequestBody List<Anomaly> anomalies) {
        return ResponseEntity.ok(analysisService.compareCampaigns(anomalies));
    }

    @Operation(summary = "Classify anomaly timing",
            description = "Weekday spike, weekend spike, periodic or consistent, with confidence and monitoring advice. " +
                    "Detection instants are assigned to days in the configured zone (segment-analysis.time-zone, UTC by default).")
    @PostMapping("/time-patterns")
    public ResponseEntity<TimePatternResult> analyzeTimePatterns(@RequestBody List<Anomaly> anomalies) {
        return ResponseEntity.ok(analysisService.analyzeTimePatterns(anomalies));
    }

    @Operation(summary = "Analyze daily KPI aggregates by day of week",
            description = "Weekday, weekend and day-of-week KPI means, plus days deviating more than 50% " +
                    "from their own day-of-week mean.")
    @PostMapping("/kpi-time-patterns")
    public ResponseEntity<KpiTimePatternResult> analyzeKpiTimePatterns(@RequestBody List<DailyAggregate> aggregates) {
        return ResponseEntity.ok(analysisService.analyzeKpiTimePatterns(aggregates));
    }

    @Operation(summary = "Summarize anomalies by metric category",
            description = "Spend-related, engagement and conversion categories; unmapped metrics are ignored.")
    @PostMapping("/metric-categories")
    public ResponseEntity<Map<MetricCategory, MetricCategoryResult>> analyzeByMetric(@RequestBody List<Anomaly> anomalies) {
        return ResponseEntity.ok(analysisService.analyzeByMetric(anomalies));
    }
}
