package com.adinsight.segment.engine.insight;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Insight;
import com.adinsight.segment.model.InsightType;
import com.adinsight.segment.model.TimePattern;
import com.adinsight.segment.model.TimePatternResult;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Surfaces a non-uniform time pattern once it is confident enough.
 */
@Component
@Order(3)
public class TimePatternRule implements InsightRule {

    static final String ID = "time-pattern";

    private final SegmentAnalysisConfig config;

    public TimePatternRule(SegmentAnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getInsightId() {
        return ID;
    }

    @Override
    public Optional<Insight> evaluate(InsightContext context) {
        TimePatternResult timePattern = context.getTimePattern();
        if (timePattern == null
                || timePattern.getPattern() == TimePattern.CONSISTENT
                || timePattern.getConfidence() <= config.getInsights().getTimePatternMinConfidence()) {
            return Optional.empty();
        }

        return Optional.of(Insight.builder()
                .id(ID)
                .type(InsightType.INFO)
                .title("Time pattern detected")
                .description(timePattern.getDetails())
                .confidence(timePattern.getConfidence())
                .actionItems(timePattern.getRecommendedMonitoring())
                .build());
    }
}
