package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.CampaignComparison;
import com.adinsight.segment.model.Severity;
import com.adinsight.segment.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.adinsight.segment.testutil.TestDataFactory.anomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CampaignComparatorTest {

    private CampaignComparator comparator;

    @BeforeEach
    void setUp() {
        comparator = new CampaignComparator(new SegmentAnalysisConfig());
    }

    @Test
    void compare_emptyInput_returnsEmptyList() {
        assertThat(comparator.compare(Collections.emptyList())).isEmpty();
    }

    @Test
    void compare_sortsMostProblematicCampaignFirst() {
        List<Anomaly> anomalies = List.of(
                anomaly().campaignId("c2").campaignName("Campaign B").severity(Severity.INFO).build(),
                anomaly().campaignId("c1").campaignName("Campaign A").severity(Severity.CRITICAL).metric("ctr").build(),
                anomaly().campaignId("c1").campaignName("Campaign A").severity(Severity.CRITICAL).metric("cpa").build());

        List<CampaignComparison> result = comparator.compare(anomalies);

        assertThat(result).hasSize(2);
        assertThat(result.get(0).getCampaignName()).isEqualTo("Campaign A");
        assertThat(result.get(0).getAnomalyCount()).isEqualTo(2);
        assertThat(result.get(0).getAvgSeverity()).isEqualTo(3.0);
        assertThat(result.get(1).getCampaignName()).isEqualTo("Campaign B");
        assertThat(result.get(1).getAnomalyCount()).isEqualTo(1);
    }

    @Test
    void compare_healthScoreFollowsFormula() {
        // 100 - 3*10 - 3*15 = 25
        List<Anomaly> anomalies = List.of(
                TestDataFactory.createAnomaly("c1", "ctr", Severity.CRITICAL),
                TestDataFactory.createAnomaly("c1", "ctr", Severity.CRITICAL),
                TestDataFactory.createAnomaly("c1", "ctr", Severity.CRITICAL));

        assertThat(comparator.compare(anomalies).get(0).getHealthScore()).isEqualTo(25.0);
    }

    @Test
    void compare_avgSeverityIsNotRounded() {
        // (3 + 2 + 2) / 3
        List<Anomaly> anomalies = List.of(
                TestDataFactory.createAnomaly("c1", "ctr", Severity.CRITICAL),
                TestDataFactory.createAnomaly("c1", "ctr", Severity.WARNING),
                TestDataFactory.createAnomaly("c1", "ctr", Severity.WARNING));

        CampaignComparison comparison = comparator.compare(anomalies).get(0);

        assertThat(comparison.getAvgSeverity()).isCloseTo(7.0 / 3.0, within(1e-9));
        assertThat(comparison.getHealthScore()).isCloseTo(100 - 30 - 35.0, within(1e-9));
    }

    @Test
    void compare_healthScoreNeverNegative_andDecreasesWithCriticalCount() {
        double previous = 100.0;
        for (int count = 1; count <= 12; count++) {
            List<Anomaly> anomalies = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                anomalies.add(TestDataFactory.createAnomaly("c1", "spend", Severity.CRITICAL));
            }

            double health = comparator.compare(anomalies).get(0).getHealthScore();

            assertThat(health).isBetween(0.0, 100.0);
            if (previous > 0) {
                assertThat(health).isLessThan(previous);
            }
            previous = health;
        }
    }

    @Test
    void compare_tracksSignedMeanChangePerMetric() {
        List<Anomaly> anomalies = List.of(
                anomaly().campaignId("c1").metric("ctr").changePercent(50.0).build(),
                anomaly().campaignId("c1").metric("ctr").changePercent(30.0).build(),
                anomaly().campaignId("c1").metric("cpa").changePercent(-25.0).build());

        CampaignComparison comparison = comparator.compare(anomalies).get(0);

        assertThat(comparison.getMetrics()).containsOnlyKeys("ctr", "cpa");
        assertThat(comparison.getMetrics().get("ctr").getAnomalyCount()).isEqualTo(2);
        assertThat(comparison.getMetrics().get("ctr").getAvgChange()).isEqualTo(40.0);
        assertThat(comparison.getMetrics().get("cpa").getAnomalyCount()).isEqualTo(1);
        assertThat(comparison.getMetrics().get("cpa").getAvgChange()).isEqualTo(-25.0);
    }

    @Test
    void compare_equalHealth_breaksTieByCampaignName() {
        List<Anomaly> anomalies = List.of(
                anomaly().campaignId("c1").campaignName("Zeta").severity(Severity.WARNING).build(),
                anomaly().campaignId("c2").campaignName("Alpha").severity(Severity.WARNING).build());

        List<CampaignComparison> result = comparator.compare(anomalies);

        assertThat(result).extracting(CampaignComparison::getCampaignName).containsExactly("Alpha", "Zeta");
    }
}
