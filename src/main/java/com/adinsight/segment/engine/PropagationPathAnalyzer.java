package com.adinsight.segment.engine;

import com.adinsight.segment.config.SegmentAnalysisConfig;
import com.adinsight.segment.model.Anomaly;
import com.adinsight.segment.model.PropagationPath;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks for a root-cause chain inside a single campaign: an anomaly followed by
 * further anomalies of the same campaign within the propagation window.
 *
 * Only the first qualifying cluster is returned, visiting campaigns in
 * first-seen order. Independent clusters in later campaigns are not reported.
 */
@Component
public class PropagationPathAnalyzer {

    private static final Comparator<Anomaly> BY_DETECTION_TIME = Comparator.comparing(Anomaly::getDetectedAt);

    private final SegmentAnalysisConfig config;

    public PropagationPathAnalyzer(SegmentAnalysisConfig config) {
        this.config = config;
    }

    public Optional<PropagationPath> analyze(List<Anomaly> anomalies) {
        Duration window = Duration.ofHours(config.getPropagation().getWindowHours());

        for (Map.Entry<String, List<Anomaly>> entry : SegmentBuilder.groupByCampaign(anomalies).entrySet()) {
            if (entry.getValue().size() < 2) continue;

            List<Anomaly> ordered = new ArrayList<>(entry.getValue());
            // stable: simultaneous anomalies keep input order until the root tie-break below
            ordered.sort(BY_DETECTION_TIME);

            for (int start = 0; start < ordered.size() - 1; start++) {
                Instant windowEnd = ordered.get(start).getDetectedAt().plus(window);
                int end = start + 1;
                while (end < ordered.size() && !ordered.get(end).getDetectedAt().isAfter(windowEnd)) {
                    end++;
                }
                if (end - start >= 2) {
                    return Optional.of(toPath(ordered.subList(start, end)));
                }
            }
        }
        return Optional.empty();
    }

    private PropagationPath toPath(List<Anomaly> cluster) {
        Anomaly root = selectRoot(cluster);

        List<Anomaly> propagated = new ArrayList<>(cluster);
        propagated.remove(root);

        List<String> chain = new ArrayList<>();
        chain.add(root.getMetric());
        double severitySum = root.getSeverity().getWeight();
        for (Anomaly anomaly : propagated) {
            chain.add(anomaly.getMetric());
            severitySum += anomaly.getSeverity().getWeight();
        }

        return PropagationPath.builder()
                .rootAnomaly(root)
                .propagatedAnomalies(propagated)
                .propagationChain(chain)
                .impactScore(Frequencies.mean(severitySum, cluster.size()))
                .build();
    }

    /**
     * Earliest anomaly; among anomalies detected at that same instant, the most severe.
     */
    private static Anomaly selectRoot(List<Anomaly> cluster) {
        Anomaly root = cluster.get(0);
        for (Anomaly candidate : cluster) {
            if (!candidate.getDetectedAt().equals(root.getDetectedAt())) break;
            if (candidate.getSeverity().getWeight() > root.getSeverity().getWeight()) {
                root = candidate;
            }
        }
        return root;
    }
}
