package com.adinsight.segment.engine.insight;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.PropagationPath;
import com.adinsight.segment.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.adinsight.segment.testutil.TestDataFactory.anomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PropagationChainRuleTest {

    private final PropagationChainRule rule = new PropagationChainRule();

    @Test
    void evaluate_pathPresent_describesChain() {
        Anomaly root = anomaly().campaignName("Spring Sale").metric("spend").severity(Severity.CRITICAL).build();
        PropagationPath path = PropagationPath.builder()
                .rootAnomaly(root)
                .propagatedAnomalies(List.of(anomaly().metric("clicks").build()))
                .propagationChain(List.of("spend", "clicks"))
                .impactScore(2.5)
                .build();

        Optional<Insight> insight = rule.evaluate(InsightContext.builder().propagationPath(path).build());

        assertThat(insight).hasValueSatisfying(i -> {
            assertThat(i.getType()).isEqualTo(InsightType.WARNING);
            assertThat(i.getDescription()).contains("Spring Sale", "spend -> clicks");
            assertThat(i.getRelatedSegments()).containsExactly("Spring Sale");
            assertThat(i.getConfidence()).isCloseTo(2.5 / 3, within(1e-9));
        });
    }

    @Test
    void evaluate_noPath_doesNotFire() {
        assertThat(rule.evaluate(InsightContext.builder().build())).isEmpty();
    }
}
