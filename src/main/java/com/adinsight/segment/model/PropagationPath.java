package com.adinsight.segment.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Root anomaly and the same-campaign anomalies that followed it within the propagation window")
public class PropagationPath {

    @Schema(description = "Earliest anomaly of the cluster")
    private Anomaly rootAnomaly;

    @Schema(description = "Remaining anomalies of the cluster, by detection time")
    private List<Anomaly> propagatedAnomalies;

    @Schema(description = "Metric chain starting with the root metric", example = "[\"spend\", \"impressions\", \"clicks\"]")
    private List<String> propagationChain;

    @Schema(description = "Mean severity weight of the cluster", example = "2.0")
    private double impactScore;
}
