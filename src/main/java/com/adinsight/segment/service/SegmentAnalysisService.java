package com.adinsight.segment.service;

import com.adinsight.segment.config.MetricsConfig;
import com.adinsight.segment.engine.CampaignComparator;
import com.adinsight.segment.engine.CorrelationDetector;
import com.adinsight.segment.engine.KpiTimePatternAnalyzer;
import com.adinsight.segment.engine.MetricCategoryAnalyzer;
import com.adinsight.segment.engine.PropagationPathAnalyzer;
import com.adinsight.segment.engine.SegmentBuilder;
import com.adinsight.segment.engine.TimePatternDetector;
import com.adinsight.segment.engine.insight.InsightContext;
import com.adinsight.segment.engine.insight.InsightGenerator;
import com.adinsight.segment.exception.InvalidAnalysisInputException;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.CampaignComparison;
import com.adinsight.segment.model.Correlation;
import com.adinsight.segment.model.DailyAggregate;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.KpiTimePatternResult;
import com.adinsight.segment.model.MetricCategory;
import com.adinsight.segment.model.MetricCategoryResult;
import com.adinsight.segment.model.PropagationPath;
import com.adinsight.segment.model.Segment;
import com.adinsight.segment.model.SegmentAnalysisResult;
import com.adinsight.segment.model.SegmentType;
import com.adinsight.segment.model.TimePatternResult;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the segment analysis engine.
 *
 * Flow of {@link #analyzeSegments}:
 * 1. Validate the anomaly set (fail fast on missing fields)
 * 2. Build and rank campaign segments
 * 3. Compare campaigns, summarize metric categories, classify the time pattern
 * 4. Detect metric correlations and the first propagation path
 * 5. Run the insight rules over all of the above
 *
 * Every operation is a pure function of its input; nothing is stored.
 */
@Service
public class SegmentAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SegmentAnalysisService.class);

    private final AnalysisInputValidator validator;
    private final SegmentBuilder segmentBuilder;
    private final CampaignComparator campaignComparator;
    private final TimePatternDetector timePatternDetector;
    private final KpiTimePatternAnalyzer kpiTimePatternAnalyzer;
    private final MetricCategoryAnalyzer metricCategoryAnalyzer;
    private final CorrelationDetector correlationDetector;
    private final PropagationPathAnalyzer propagationPathAnalyzer;
    private final InsightGenerator insightGenerator;
    private final MetricsConfig metricsConfig;

    public SegmentAnalysisService(AnalysisInputValidator validator,
                                  SegmentBuilder segmentBuilder,
                                  CampaignComparator campaignComparator,
                                  TimePatternDetector timePatternDetector,
                                  KpiTimePatternAnalyzer kpiTimePatternAnalyzer,
                                  MetricCategoryAnalyzer metricCategoryAnalyzer,
                                  CorrelationDetector correlationDetector,
                                  PropagationPathAnalyzer propagationPathAnalyzer,
                                  InsightGenerator insightGenerator,
                                  MetricsConfig metricsConfig) {
        this.validator = validator;
        this.segmentBuilder = segmentBuilder;
        this.campaignComparator = campaignComparator;
        this.timePatternDetector = timePatternDetector;
        this.kpiTimePatternAnalyzer = kpiTimePatternAnalyzer;
        this.metricCategoryAnalyzer = metricCategoryAnalyzer;
        this.correlationDetector = correlationDetector;
        this.propagationPathAnalyzer = propagationPathAnalyzer;
        this.insightGenerator = insightGenerator;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "segment.analyze", contextualName = "analyze-segments")
    public SegmentAnalysisResult analyzeSegments(List<Anomaly> anomalies) {
        validateAnomalies("analyze_segments", anomalies);

        List<Segment> segments = segmentBuilder.buildSegments(anomalies);
        List<CampaignComparison> comparisons = campaignComparator.compare(anomalies);
        Map<MetricCategory, MetricCategoryResult> categories = metricCategoryAnalyzer.analyze(anomalies);
        TimePatternResult timePattern = timePatternDetector.detect(anomalies);
        List<Correlation> correlations = correlationDetector.detect(anomalies);
        PropagationPath propagationPath = propagationPathAnalyzer.analyze(anomalies).orElse(null);

        metricsConfig.recordCorrelations(correlations.size());
        if (propagationPath != null) {
            metricsConfig.recordPropagationDetected();
        }

        List<Insight> insights = insightGenerator.generate(InsightContext.builder()
                .anomalies(anomalies)
                .segments(segments)
                .campaignComparisons(comparisons)
                .metricCategories(categories)
                .correlations(correlations)
                .timePattern(timePattern)
                .propagationPath(propagationPath)
                .build());

        log.debug("Segment analysis: {} anomalies -> {} segments, {} correlations, {} insights, propagation={}",
                anomalies.size(), segments.size(), correlations.size(), insights.size(), propagationPath != null);

        return SegmentAnalysisResult.builder()
                .segmentType(SegmentType.CAMPAIGN)
                .segments(segments)
                .insights(insights)
                .correlations(correlations)
                .propagationPath(propagationPath)
                .campaignComparisons(comparisons)
                .metricCategories(categories)
                .timePattern(timePattern)
                .build();
    }

    @Observed(name = "segment.compare_campaigns", contextualName = "compare-campaigns")
    public List<CampaignComparison> compareCampaigns(List<Anomaly> anomalies) {
        validateAnomalies("compare_campaigns", anomalies);
        return campaignComparator.compare(anomalies);
    }

    @Observed(name = "segment.time_patterns", contextualName = "analyze-time-patterns")
    public TimePatternResult analyzeTimePatterns(List<Anomaly> anomalies) {
        validateAnomalies("time_patterns", anomalies);
        return timePatternDetector.detect(anomalies);
    }

    @Observed(name = "segment.kpi_time_patterns", contextualName = "analyze-kpi-time-patterns")
    public KpiTimePatternResult analyzeKpiTimePatterns(List<DailyAggregate> aggregates) {
        try {
            validator.validateAggregates(aggregates);
        } catch (InvalidAnalysisInputException e) {
            metricsConfig.recordInvalidInput("kpi_time_patterns");
            log.warn("Rejected kpi_time_patterns input: {}", e.getMessage());
            throw e;
        }
        metricsConfig.recordAnalysis("kpi_time_patterns", aggregates.size());

        KpiTimePatternResult result = kpiTimePatternAnalyzer.analyze(aggregates);
        log.debug("KPI time patterns: {} days, {} flagged", aggregates.size(), result.getAnomalyDays().size());
        return result;
    }

    @Observed(name = "segment.metric_categories", contextualName = "analyze-by-metric")
    public Map<MetricCategory, MetricCategoryResult> analyzeByMetric(List<Anomaly> anomalies) {
        validateAnomalies("metric_categories", anomalies);
        return metricCategoryAnalyzer.analyze(anomalies);
    }

    private void validateAnomalies(String operation, List<Anomaly> anomalies) {
        try {
            validator.validateAnomalies(anomalies);
        } catch (InvalidAnalysisInputException e) {
            metricsConfig.recordInvalidInput(operation);
            log.warn("Rejected {} input: {}", operation, e.getMessage());
            throw e;
        }
        metricsConfig.recordAnalysis(operation, anomalies.size());
    }
}
