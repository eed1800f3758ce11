package com.adinsight.segment.engine;

import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.MetricCategory;
import com.adinsight.segment.model.MetricCategoryResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Summarizes anomalies per {@link MetricCategory}. Metrics with no category are skipped.
 */
@Component
public class MetricCategoryAnalyzer {

    public Map<MetricCategory, MetricCategoryResult> analyze(List<Anomaly> anomalies) {
        Map<MetricCategory, List<Anomaly>> byCategory = new EnumMap<>(MetricCategory.class);
        for (Anomaly anomaly : anomalies) {
            Optional<MetricCategory> category = MetricCategory.fromMetric(anomaly.getMetric());
            category.ifPresent(c -> byCategory.computeIfAbsent(c, k -> new ArrayList<>()).add(anomaly));
        }

        Map<MetricCategory, MetricCategoryResult> results = new EnumMap<>(MetricCategory.class);
        byCategory.forEach((category, categoryAnomalies) -> {
            double severitySum = 0.0;
            for (Anomaly anomaly : categoryAnomalies) {
                severitySum += anomaly.getSeverity().getWeight();
            }

            results.put(category, MetricCategoryResult.builder()
                    .category(category)
                    .displayName(category.getDisplayName())
                    .anomalyCount(categoryAnomalies.size())
                    .avgSeverityScore(Frequencies.mean(severitySum, categoryAnomalies.size()))
                    .dominantType(Frequencies.mostFrequent(categoryAnomalies, Anomaly::getType))
                    .mostAffectedMetric(Frequencies.mostFrequent(categoryAnomalies, Anomaly::getMetric))
                    .build());
        });
        return results;
    }
}
