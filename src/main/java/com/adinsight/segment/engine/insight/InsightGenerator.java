package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.MetricsConfig;
import com.adinsight.segment.model.Insight;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs every registered {@link InsightRule} and ranks what fires.
 * Ranking: warnings, then recommendations, then info; within a type by confidence, highest first.
 */
@Component
public class InsightGenerator {

    private static final Logger log = LoggerFactory.getLogger(InsightGenerator.class);

    private static final Comparator<Insight> RANKING = Comparator
            .comparing(Insight::getType)
            .thenComparing(Comparator.comparingDouble(Insight::getConfidence).reversed());

    private final Map<String, InsightRule> rules;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public InsightGenerator(List<InsightRule> rules, Tracer tracer, MetricsConfig metricsConfig) {
        this.rules = new LinkedHashMap<>();
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (InsightRule rule : rules) {
            this.rules.put(rule.getInsightId(), rule);
            log.info("Registered insight rule: {} -> {}", rule.getInsightId(), rule.getClass().getSimpleName());
        }
    }

    public List<Insight> generate(InsightContext context) {
        List<Insight> insights = new ArrayList<>();

        for (InsightRule rule : rules.values()) {
            Span ruleSpan = tracer.nextSpan()
                    .name("insight.evaluate")
                    .tag("insight.id", rule.getInsightId())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                Optional<Insight> insight = rule.evaluate(context);
                ruleSpan.tag("insight.fired", String.valueOf(insight.isPresent()));

                if (insight.isPresent()) {
                    insights.add(insight.get());
                    metricsConfig.recordInsight(rule.getInsightId());
                    log.debug("Insight fired: {} - {}", rule.getInsightId(), insight.get().getTitle());
                }
            } catch (RuntimeException e) {
                ruleSpan.error(e);
                log.error("Error evaluating insight rule {}: {}", rule.getInsightId(), e.getMessage(), e);
                // one faulty rule must not drop the other insights
            } finally {
                ruleSpan.end();
            }
        }

        insights.sort(RANKING);
        return insights;
    }
}
