package com.z254.butterfly.sentinel.telemetry;

import java.time.Instant;

/**
 * One recorded observation. Immutable once recorded.
 */
public record MetricSample(String serviceName, String metricName, double value, Instant timestamp) {

    public MetricKey key() {
        return new MetricKey(serviceName, metricName);
    }

    /**
     * Validate and build a sample.
     *
     * @throws IllegalArgumentException for blank names, a missing timestamp or a non-finite value
     */
    public static MetricSample of(String serviceName, String metricName, double value, Instant timestamp) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must not be blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite for " + serviceName + "." + metricName);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        return new MetricSample(serviceName, metricName, value, timestamp);
    }
}
