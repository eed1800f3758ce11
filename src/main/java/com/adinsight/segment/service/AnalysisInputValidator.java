package com.adinsight.segment.service;

import com.adinsight.segment.exception.InvalidAnalysisInputException;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.DailyAggregate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fail-fast checks on analysis input. Scores are never computed from partially
 * populated records.
 */
@Component
public class AnalysisInputValidator {

    public void validateAnomalies(List<Anomaly> anomalies) {
        if (anomalies == null) {
            throw new InvalidAnalysisInputException("anomalies must not be null", "anomalies");
        }
        for (int i = 0; i < anomalies.size(); i++) {
            Anomaly anomaly = anomalies.get(i);
            String prefix = "anomalies[" + i + "]";
            if (anomaly == null) {
                throw new InvalidAnalysisInputException(prefix + " must not be null", prefix);
            }
            requireText(anomaly.getId(), prefix, "id");
            requireText(anomaly.getCampaignId(), prefix, "campaignId");
            requireText(anomaly.getMetric(), prefix, "metric");
            requirePresent(anomaly.getType(), prefix, "type");
            requirePresent(anomaly.getSeverity(), prefix, "severity");
            requirePresent(anomaly.getDetectedAt(), prefix, "detectedAt");
            requirePresent(anomaly.getChangePercent(), prefix, "changePercent");
            if (!Double.isFinite(anomaly.getChangePercent())) {
                throw new InvalidAnalysisInputException(
                        prefix + ".changePercent must be a finite number (id=" + anomaly.getId() + ")",
                        prefix + ".changePercent");
            }
        }
    }

    public void validateAggregates(List<DailyAggregate> aggregates) {
        if (aggregates == null) {
            throw new InvalidAnalysisInputException("dailyAggregates must not be null", "dailyAggregates");
        }
        for (int i = 0; i < aggregates.size(); i++) {
            DailyAggregate aggregate = aggregates.get(i);
            String prefix = "dailyAggregates[" + i + "]";
            if (aggregate == null) {
                throw new InvalidAnalysisInputException(prefix + " must not be null", prefix);
            }
            requirePresent(aggregate.getDate(), prefix, "date");
        }
    }

    private static void requireText(String value, String prefix, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidAnalysisInputException(prefix + "." + field + " is required", prefix + "." + field);
        }
    }

    private static void requirePresent(Object value, String prefix, String field) {
        if (value == null) {
            throw new InvalidAnalysisInputException(prefix + "." + field + " is required", prefix + "." + field);
        }
    }
}
