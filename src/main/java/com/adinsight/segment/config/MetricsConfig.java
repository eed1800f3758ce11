package com.adinsight.segment.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(String operation, int inputSize) {
        Counter.builder("segment.analysis.count")
                .tag("operation", operation)
                .register(registry)
                .increment();

        DistributionSummary.builder("segment.analysis.input_size")
                .tag("operation", operation)
                .register(registry)
                .record(inputSize);
    }

    public void recordInsight(String insightId) {
        Counter.builder("segment.insight.count")
                .tag("insight_id", insightId)
                .register(registry)
                .increment();
    }

    public void recordCorrelations(int count) {
        DistributionSummary.builder("segment.correlation.found")
                .register(registry)
                .record(count);
    }

    public void recordPropagationDetected() {
        Counter.builder("segment.propagation.detected.count")
                .register(registry)
                .increment();
    }

    public void recordInvalidInput(String operation) {
        Counter.builder("segment.analysis.invalid_input.count")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }
}
