package com.z254.butterfly.sentinel.detection;

/**
 * Classification of an anomalous metric window.
 */
public enum AnomalyType {
    PERFORMANCE_DEGRADATION("Performance degradation"),
    RESOURCE_EXHAUSTION("Resource exhaustion"),
    ERROR_SPIKE("Error spike"),
    LATENCY_INCREASE("Latency increase"),
    THROUGHPUT_DROP("Throughput drop"),
    MEMORY_LEAK("Memory leak"),
    CPU_SATURATION("CPU saturation"),
    NETWORK_ISSUES("Network issues"),
    DEPENDENCY_FAILURE("Dependency failure"),
    DATA_QUALITY_ISSUE("Data quality issue");

    private final String displayName;

    AnomalyType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
