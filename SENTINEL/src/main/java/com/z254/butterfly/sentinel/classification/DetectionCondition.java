package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics.MetricDimension;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Hard thresholds that open an incident. Declaration order is evaluation order: critical
 * first, first match wins.
 */
public enum DetectionCondition {

    // ========== Critical ==========
    CRITICAL_CPU(IncidentSeverity.CRITICAL, IncidentType.CRITICAL_CPU_UTILIZATION,
            EnumSet.of(MetricDimension.CPU), (m, c) -> m.cpu() > 0.95),
    CRITICAL_MEMORY(IncidentSeverity.CRITICAL, IncidentType.CRITICAL_MEMORY_USAGE,
            EnumSet.of(MetricDimension.MEMORY), (m, c) -> m.memory() > 0.98),
    CRITICAL_ERRORS(IncidentSeverity.CRITICAL, IncidentType.CRITICAL_ERROR_RATE,
            EnumSet.of(MetricDimension.ERROR_RATE), (m, c) -> m.errors() > 0.5),
    CRITICAL_RESPONSE_TIME(IncidentSeverity.CRITICAL, IncidentType.CRITICAL_RESPONSE_TIME,
            EnumSet.of(MetricDimension.RESPONSE_TIME), (m, c) -> m.responseTimeMs() > 10_000),

    // ========== High ==========
    HIGH_CPU(IncidentSeverity.HIGH, IncidentType.HIGH_CPU_UTILIZATION,
            EnumSet.of(MetricDimension.CPU), (m, c) -> m.cpu() > 0.85),
    HIGH_MEMORY(IncidentSeverity.HIGH, IncidentType.HIGH_MEMORY_USAGE,
            EnumSet.of(MetricDimension.MEMORY), (m, c) -> m.memory() > 0.9),
    DISK_SPACE(IncidentSeverity.HIGH, IncidentType.DISK_SPACE_CRITICAL,
            EnumSet.of(MetricDimension.DISK), (m, c) -> m.disk() > 0.95),
    HIGH_ERRORS(IncidentSeverity.HIGH, IncidentType.HIGH_ERROR_RATE,
            EnumSet.of(MetricDimension.ERROR_RATE), (m, c) -> m.errors() > 0.1),
    HIGH_RESPONSE_TIME(IncidentSeverity.HIGH, IncidentType.HIGH_RESPONSE_TIME,
            EnumSet.of(MetricDimension.RESPONSE_TIME), (m, c) -> m.responseTimeMs() > 5_000),

    // ========== Medium ==========
    RESOURCE_CONTENTION(IncidentSeverity.MEDIUM, IncidentType.RESOURCE_CONTENTION,
            EnumSet.of(MetricDimension.CPU, MetricDimension.MEMORY), (m, c) -> m.cpu() > 0.8 && m.memory() > 0.8),
    ELEVATED_ERRORS(IncidentSeverity.MEDIUM, IncidentType.ELEVATED_ERROR_RATE,
            EnumSet.of(MetricDimension.ERROR_RATE), (m, c) -> m.errors() > 0.05),
    THROUGHPUT_DEGRADATION(IncidentSeverity.MEDIUM, IncidentType.THROUGHPUT_DEGRADATION,
            EnumSet.of(MetricDimension.THROUGHPUT),
            (m, c) -> m.throughputOrMax() < 10 && IncidentContext.LOAD_SPIKE.equals(c.getLoadPattern())),
    MULTIPLE_ALERTS(IncidentSeverity.MEDIUM, IncidentType.MULTIPLE_ALERTS,
            EnumSet.noneOf(MetricDimension.class), (m, c) -> c.getRelatedAlerts().size() > 3),

    // ========== Low ==========
    SLOW_RESPONSE(IncidentSeverity.LOW, IncidentType.SLOW_RESPONSE_TIME,
            EnumSet.of(MetricDimension.RESPONSE_TIME), (m, c) -> m.responseTimeMs() > 2_000),
    QUEUE_BUILDUP(IncidentSeverity.LOW, IncidentType.QUEUE_BUILDUP,
            EnumSet.of(MetricDimension.QUEUE), (m, c) -> m.queue() > 100);

    private final IncidentSeverity severity;
    private final IncidentType type;
    private final Set<MetricDimension> dimensions;
    private final BiPredicate<IncidentMetrics, IncidentContext> predicate;

    DetectionCondition(IncidentSeverity severity, IncidentType type, Set<MetricDimension> dimensions,
                       BiPredicate<IncidentMetrics, IncidentContext> predicate) {
        this.severity = severity;
        this.type = type;
        this.dimensions = dimensions;
        this.predicate = predicate;
    }

    public boolean matches(IncidentMetrics metrics, IncidentContext context) {
        return predicate.test(metrics, context);
    }

    public boolean concerns(MetricDimension dimension) {
        return dimensions.contains(dimension);
    }

    public IncidentSeverity getSeverity() {
        return severity;
    }

    public IncidentType getType() {
        return type;
    }
}
