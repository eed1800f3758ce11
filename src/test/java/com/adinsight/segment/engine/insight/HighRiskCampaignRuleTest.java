package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.engine.SegmentBuilder;
import com.adinsight.segment.engine.TimePatternDetector;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.adinsight.segment.testutil.TestDataFactory.createAnomaly;
import static org.assertj.core.api.Assertions.assertThat;

class HighRiskCampaignRuleTest {

    private SegmentAnalysisConfig config;
    private SegmentBuilder segmentBuilder;
    private HighRiskCampaignRule rule;

    @BeforeEach
    void setUp() {
        config = new SegmentAnalysisConfig();
        segmentBuilder = new SegmentBuilder(new TimePatternDetector(config));
        rule = new HighRiskCampaignRule(config);
    }

    @Test
    void evaluate_campaignWithTwoCriticals_firesWarning() {
        List<Anomaly> anomalies = List.of(
                createAnomaly("c1", "spend", Severity.CRITICAL),
                createAnomaly("c1", "cpa", Severity.CRITICAL),
                createAnomaly("c2", "ctr", Severity.CRITICAL));

        Optional<Insight> insight = rule.evaluate(context(anomalies));

        assertThat(insight).hasValueSatisfying(i -> {
            assertThat(i.getId()).isEqualTo("high-risk-campaigns");
            assertThat(i.getType()).isEqualTo(InsightType.WARNING);
            assertThat(i.getConfidence()).isEqualTo(0.9);
            assertThat(i.getRelatedSegments()).containsExactly("Campaign c1");
            assertThat(i.getActionItems()).isNotEmpty();
        });
    }

    @Test
    void evaluate_criticalsSpreadAcrossCampaigns_doesNotFire() {
        List<Anomaly> anomalies = List.of(
                createAnomaly("c1", "spend", Severity.CRITICAL),
                createAnomaly("c2", "cpa", Severity.CRITICAL),
                createAnomaly("c1", "ctr", Severity.WARNING));

        assertThat(rule.evaluate(context(anomalies))).isEmpty();
    }

    @Test
    void evaluate_thresholdIsConfigurable() {
        config.getInsights().setHighRiskCriticalCount(1);

        Optional<Insight> insight = rule.evaluate(context(List.of(createAnomaly("c2", "cpa", Severity.CRITICAL))));

        assertThat(insight).hasValueSatisfying(i ->
                assertThat(i.getRelatedSegments()).containsExactly("Campaign c2"));
    }

    private InsightContext context(List<Anomaly> anomalies) {
        return InsightContext.builder()
                .anomalies(anomalies)
                .segments(segmentBuilder.buildSegments(anomalies))
                .build();
    }
}
