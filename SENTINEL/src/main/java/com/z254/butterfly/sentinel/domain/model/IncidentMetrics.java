package com.z254.butterfly.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of a service's latest metric values. Fields are null when the service does not
 * report the dimension.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IncidentMetrics {

    private Double cpuUsage;
    private Double memoryUsage;
    private Double diskUsage;
    private Double networkIo;
    private Double errorRate;
    /** Milliseconds */
    private Double responseTime;
    private Double throughput;
    private Double activeConnections;
    private Double queueDepth;
    private Instant capturedAt;

    /**
     * Map latest values by metric name onto the incident dimensions.
     */
    public static IncidentMetrics fromLatest(Map<String, Double> latestValues, Instant capturedAt) {
        IncidentMetrics metrics = IncidentMetrics.builder().capturedAt(capturedAt).build();
        latestValues.forEach((metric, value) -> {
            MetricDimension dimension = MetricDimension.of(metric);
            if (dimension != null) {
                dimension.set(metrics, value);
            }
        });
        return metrics;
    }

    public double cpu() {
        return orZero(cpuUsage);
    }

    public double memory() {
        return orZero(memoryUsage);
    }

    public double disk() {
        return orZero(diskUsage);
    }

    public double errors() {
        return orZero(errorRate);
    }

    public double responseTimeMs() {
        return orZero(responseTime);
    }

    public double queue() {
        return orZero(queueDepth);
    }

    /**
     * Throughput defaults high so a missing series never reads as a throughput collapse.
     */
    public double throughputOrMax() {
        return throughput == null ? Double.MAX_VALUE : throughput;
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    /**
     * Incident dimension a metric name maps to, by name substring.
     */
    public enum MetricDimension {
        CPU,
        MEMORY,
        DISK,
        NETWORK,
        ERROR_RATE,
        RESPONSE_TIME,
        THROUGHPUT,
        CONNECTIONS,
        QUEUE;

        public static MetricDimension of(String metricName) {
            String name = metricName.toLowerCase(Locale.ROOT);
            if (name.contains("cpu")) {
                return CPU;
            }
            if (name.contains("memory")) {
                return MEMORY;
            }
            if (name.contains("disk")) {
                return DISK;
            }
            if (name.contains("error")) {
                return ERROR_RATE;
            }
            if (name.contains("latency") || name.contains("response_time")) {
                return RESPONSE_TIME;
            }
            if (name.contains("throughput") || name.contains("request_rate")) {
                return THROUGHPUT;
            }
            if (name.contains("connection")) {
                return CONNECTIONS;
            }
            if (name.contains("queue")) {
                return QUEUE;
            }
            if (name.contains("network")) {
                return NETWORK;
            }
            return null;
        }

        void set(IncidentMetrics metrics, double value) {
            switch (this) {
                case CPU -> metrics.setCpuUsage(value);
                case MEMORY -> metrics.setMemoryUsage(value);
                case DISK -> metrics.setDiskUsage(value);
                case NETWORK -> metrics.setNetworkIo(value);
                case ERROR_RATE -> metrics.setErrorRate(value);
                case RESPONSE_TIME -> metrics.setResponseTime(value);
                case THROUGHPUT -> metrics.setThroughput(value);
                case CONNECTIONS -> metrics.setActiveConnections(value);
                case QUEUE -> metrics.setQueueDepth(value);
            }
        }
    }
}
