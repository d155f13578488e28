package com.z254.butterfly.sentinel.telemetry;

import java.util.Objects;

/**
 * Identity of one telemetry series.
 */
public record MetricKey(String serviceName, String metricName) {

    public MetricKey {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(metricName, "metricName");
    }

    @Override
    public String toString() {
        return serviceName + "." + metricName;
    }
}
