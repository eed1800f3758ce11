package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.MetricsConfig;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.adinsight.segment.testutil.TestDataFactory.createInsight;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InsightGeneratorTest {

    @Mock private InsightRule silent;
    @Mock private InsightRule broken;

    private MeterRegistry registry;
    private MetricsConfig metricsConfig;
    private InsightContext context;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
        context = InsightContext.builder()
                .anomalies(Collections.emptyList())
                .segments(Collections.emptyList())
                .build();
    }

    @Test
    void generate_ranksWarningsThenRecommendationsThenInfo_byConfidence() {
        InsightGenerator generator = new InsightGenerator(List.of(
                rule("info-low", createInsight("info-low", InsightType.INFO, 0.5)),
                rule("rec", createInsight("rec", InsightType.RECOMMENDATION, 0.8)),
                rule("warn-low", createInsight("warn-low", InsightType.WARNING, 0.6)),
                rule("info-high", createInsight("info-high", InsightType.INFO, 0.9)),
                rule("warn-high", createInsight("warn-high", InsightType.WARNING, 0.95))),
                Tracer.NOOP, metricsConfig);

        List<Insight> insights = generator.generate(context);

        assertThat(insights).extracting(Insight::getId)
                .containsExactly("warn-high", "warn-low", "rec", "info-high", "info-low");
    }

    @Test
    void generate_ruleNotFiring_contributesNothing() {
        when(silent.getInsightId()).thenReturn("silent");
        when(silent.evaluate(any())).thenReturn(Optional.empty());

        InsightGenerator generator = new InsightGenerator(List.of(silent,
                rule("fires", createInsight("fires", InsightType.INFO, 0.7))), Tracer.NOOP, metricsConfig);

        assertThat(generator.generate(context)).extracting(Insight::getId).containsExactly("fires");
    }

    @Test
    void generate_throwingRule_isSkippedAndOthersStillRun() {
        when(broken.getInsightId()).thenReturn("broken");
        when(broken.evaluate(any())).thenThrow(new IllegalStateException("boom"));

        InsightGenerator generator = new InsightGenerator(List.of(broken,
                rule("ok", createInsight("ok", InsightType.WARNING, 0.9))), Tracer.NOOP, metricsConfig);

        assertThat(generator.generate(context)).extracting(Insight::getId).containsExactly("ok");
    }

    @Test
    void generate_countsFiredInsights() {
        InsightGenerator generator = new InsightGenerator(List.of(
                rule("ok", createInsight("ok", InsightType.WARNING, 0.9))), Tracer.NOOP, metricsConfig);

        generator.generate(context);
        generator.generate(context);

        assertThat(registry.find("segment.insight.count").tag("insight_id", "ok").counter())
                .isNotNull()
                .satisfies(counter -> assertThat(counter.count()).isEqualTo(2.0));
    }

    private static InsightRule rule(String id, Insight insight) {
        InsightRule rule = mock(InsightRule.class);
        when(rule.getInsightId()).thenReturn(id);
        when(rule.evaluate(any())).thenReturn(Optional.of(insight));
        return rule;
    }
}
