package com.z254.butterfly.sentinel.domain.model;

import java.util.Locale;

/**
 * Incident categories produced by the detection conditions, their refinements, and the
 * knowledge base.
 */
public enum IncidentType {
    // Critical conditions
    CRITICAL_CPU_UTILIZATION,
    CRITICAL_MEMORY_USAGE,
    CRITICAL_ERROR_RATE,
    CRITICAL_RESPONSE_TIME,
    // High
    HIGH_CPU_UTILIZATION,
    HIGH_MEMORY_USAGE,
    DISK_SPACE_CRITICAL,
    HIGH_ERROR_RATE,
    HIGH_RESPONSE_TIME,
    // Medium
    RESOURCE_CONTENTION,
    ELEVATED_ERROR_RATE,
    THROUGHPUT_DEGRADATION,
    MULTIPLE_ALERTS,
    // Low
    SLOW_RESPONSE_TIME,
    QUEUE_BUILDUP,
    // Refined from alert type or learned from history
    MEMORY_LEAK,
    DATABASE_CONNECTION_ERROR,
    CACHE_OVERFLOW,
    API_RATE_LIMIT_EXCEEDED,
    NETWORK_TIMEOUT;

    /**
     * Lower-case wire name, e.g. {@code high_cpu_utilization}.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
