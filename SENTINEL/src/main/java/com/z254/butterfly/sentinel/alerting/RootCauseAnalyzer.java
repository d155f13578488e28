package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates the root cause of an anomaly by correlating the anomalous series with the other
 * metrics of the same service over the same window.
 */
@Slf4j
@Component
public class RootCauseAnalyzer {

    static final int MIN_ALIGNED_POINTS = 5;
    static final double STRONG_CONFIDENCE = 0.8;
    static final double ISOLATED_CONFIDENCE = 0.6;

    private final TelemetryBuffer buffer;
    private final double significantCorrelation;
    private final double strongCorrelation;

    public RootCauseAnalyzer(TelemetryBuffer buffer, SentinelProperties properties) {
        this.buffer = buffer;
        this.significantCorrelation = properties.getAlerting().getSignificantCorrelation();
        this.strongCorrelation = properties.getAlerting().getStrongCorrelation();
    }

    public RootCause analyze(MetricWindow window, AnomalyType type) {
        Map<String, Double> correlated = correlatedMetrics(window);

        boolean strong = correlated.values().stream().anyMatch(r -> Math.abs(r) > strongCorrelation);
        List<String> factors = new ArrayList<>(typicalFactors(type));
        correlated.forEach((metric, r) ->
                factors.add(String.format("Correlated with %s (r=%.2f)", metric, r)));

        String primary = strong ? "Strong correlation with other service metrics" : "Isolated metric anomaly";
        double confidence = strong ? STRONG_CONFIDENCE : ISOLATED_CONFIDENCE;

        return RootCause.builder()
                .primaryFactor(primary)
                .confidence(confidence)
                .contributingFactors(factors)
                .correlatedMetrics(correlated)
                .build();
    }

    // ========== Private Methods ==========

    private Map<String, Double> correlatedMetrics(MetricWindow window) {
        Map<String, Double> result = new LinkedHashMap<>();
        double[] target = window.values();
        if (target.length < MIN_ALIGNED_POINTS) {
            return result;
        }

        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (String other : buffer.metricsFor(window.serviceName())) {
            if (other.equals(window.metricName())) {
                continue;
            }
            double[] sibling = buffer.window(window.serviceName(), other, target.length).values();
            int n = Math.min(sibling.length, target.length);
            if (n < MIN_ALIGNED_POINTS) {
                continue;
            }
            double[] x = Arrays.copyOfRange(target, target.length - n, target.length);
            double[] y = Arrays.copyOfRange(sibling, sibling.length - n, sibling.length);
            double r = pearson.correlation(x, y);
            // Constant series have no defined correlation
            if (!Double.isNaN(r) && Math.abs(r) > significantCorrelation) {
                result.put(other, r);
            }
        }
        return result;
    }

    private static List<String> typicalFactors(AnomalyType type) {
        return switch (type) {
            case MEMORY_LEAK -> List.of("Gradual memory accumulation", "Unreleased resources or unbounded caches");
            case PERFORMANCE_DEGRADATION -> List.of("Increased load or resource contention",
                    "Inefficient code paths after a recent change");
            case CPU_SATURATION -> List.of("Compute-bound workload exceeding provisioned capacity");
            case ERROR_SPIKE -> List.of("Faulty deployment or failing downstream call");
            case LATENCY_INCREASE, NETWORK_ISSUES -> List.of("Slow downstream calls or network congestion");
            default -> List.of();
        };
    }
}
