package com.z254.butterfly.sentinel.alerting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlation-based root-cause estimate attached to an alert.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RootCause {

    private String primaryFactor;

    private double confidence;

    @Builder.Default
    private List<String> contributingFactors = new ArrayList<>();

    /** Significantly correlated sibling metrics and their Pearson coefficient */
    @Builder.Default
    private Map<String, Double> correlatedMetrics = new LinkedHashMap<>();

    public boolean hasSignificantCorrelations() {
        return !correlatedMetrics.isEmpty();
    }
}
