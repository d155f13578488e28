package com.z254.butterfly.sentinel.detection;

import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Deterministic rule table mapping a metric name and the shape of its window to an
 * {@link AnomalyType}. Rules are evaluated top to bottom; anything unmatched is a
 * performance degradation.
 */
@Component
public class AnomalyTypeClassifier {

    static final double CPU_SATURATION_LEVEL = 0.8;
    static final double LEAK_MIN_R_SQUARED = 0.8;
    static final int LEAK_MIN_POINTS = 5;

    public AnomalyType classify(MetricWindow window) {
        String metric = window.metricName().toLowerCase(Locale.ROOT);
        double[] values = window.values();

        if (metric.contains("latency") || metric.contains("response_time")) {
            if (values.length == 0) {
                return AnomalyType.PERFORMANCE_DEGRADATION;
            }
            return StatUtils.mean(values) > new Median().evaluate(values)
                    ? AnomalyType.LATENCY_INCREASE
                    : AnomalyType.PERFORMANCE_DEGRADATION;
        }
        if (metric.contains("error") || metric.contains("failure")) {
            return AnomalyType.ERROR_SPIKE;
        }
        if (metric.contains("memory")) {
            return isSteadyGrowth(values) ? AnomalyType.MEMORY_LEAK : AnomalyType.RESOURCE_EXHAUSTION;
        }
        if (metric.contains("cpu")) {
            if (values.length == 0) {
                return AnomalyType.PERFORMANCE_DEGRADATION;
            }
            boolean saturated = values[values.length - 1] > CPU_SATURATION_LEVEL
                    || StatUtils.mean(values) > CPU_SATURATION_LEVEL;
            return saturated ? AnomalyType.CPU_SATURATION : AnomalyType.PERFORMANCE_DEGRADATION;
        }
        if (metric.contains("throughput") || metric.contains("request")) {
            return AnomalyType.THROUGHPUT_DROP;
        }
        if (metric.contains("network") || metric.contains("connection")) {
            return AnomalyType.NETWORK_ISSUES;
        }
        if (metric.contains("dependency") || metric.contains("upstream")) {
            return AnomalyType.DEPENDENCY_FAILURE;
        }
        return AnomalyType.PERFORMANCE_DEGRADATION;
    }

    /**
     * Monotone-ish growth: positive slope with a linear fit that explains most of the variance.
     */
    boolean isSteadyGrowth(double[] values) {
        if (values.length <= LEAK_MIN_POINTS) {
            return false;
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(i, values[i]);
        }
        double slope = regression.getSlope();
        double rSquared = regression.getRSquare();
        return slope > 0 && !Double.isNaN(rSquared) && rSquared >= LEAK_MIN_R_SQUARED;
    }
}
