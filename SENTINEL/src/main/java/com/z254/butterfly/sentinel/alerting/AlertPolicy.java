package com.z254.butterfly.sentinel.alerting;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.forecast.Forecast;
import com.z254.butterfly.sentinel.forecast.ForecastPoint;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure alert content rules: severity, time to impact, impact text, recommendations and ids.
 */
public final class AlertPolicy {

    static final int MIN_IMPACT_HISTORY = 5;
    static final int ALERT_ID_LENGTH = 12;

    private static final Set<AnomalyType> AUTO_RESOLVABLE = EnumSet.of(
            AnomalyType.PERFORMANCE_DEGRADATION,
            AnomalyType.THROUGHPUT_DROP);

    private final SentinelProperties.Alerting config;

    public AlertPolicy(SentinelProperties.Alerting config) {
        this.config = config;
    }

    /**
     * Score bands, bumped one level for types that tend to cascade.
     */
    public AlertSeverity severity(double score, AnomalyType type) {
        AlertSeverity base = AlertSeverity.fromScore(score);
        return config.getCriticalEscalationTypes().contains(type) ? base.escalate() : base;
    }

    /**
     * Steps until the forecast first crosses the type's impact threshold: {@code 1.5x} the
     * current value for memory leaks, {@code 2x} for performance degradation, {@code 1.3x} otherwise.
     */
    public Duration timeToImpact(MetricWindow window, AnomalyType type, Optional<Forecast> forecast, Duration step) {
        if (window.size() < MIN_IMPACT_HISTORY) {
            return config.getShortHistoryImpactWindow();
        }
        if (forecast.isEmpty() || forecast.get().points().isEmpty()) {
            return config.getDefaultImpactWindow();
        }
        List<ForecastPoint> points = forecast.get().points();
        double threshold = window.latestValue() * impactMultiplier(type);
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i).value() > threshold) {
                return step.multipliedBy(i + 1L);
            }
        }
        return step.multipliedBy(points.size());
    }

    public String predictedImpact(AnomalyType type, AlertSeverity severity) {
        String description = impactDescription(type);
        if (severity.isCriticalOrAbove()) {
            return "CRITICAL: " + description + " - immediate action required";
        }
        if (severity == AlertSeverity.HIGH) {
            return "HIGH IMPACT: " + description + " - urgent attention needed";
        }
        return description;
    }

    /**
     * Type-specific playbook. Critical and emergency alerts are prefixed with a restart
     * suggestion and end with an on-call escalation.
     */
    public List<String> recommendations(String service, AnomalyType type, AlertSeverity severity) {
        List<String> actions = new ArrayList<>(playbook(type));
        int limit = config.getMaxRecommendations();
        if (severity.isCriticalOrAbove()) {
            actions = new ArrayList<>(actions.subList(0, Math.min(actions.size(), Math.max(0, limit - 2))));
            actions.add(0, "URGENT: Consider immediate " + service + " service restart");
            actions.add("Escalate to on-call engineer immediately");
            return actions;
        }
        return actions.size() > limit ? new ArrayList<>(actions.subList(0, limit)) : actions;
    }

    public boolean isAutoResolvable(AnomalyType type, AlertSeverity severity) {
        return !severity.isCriticalOrAbove() && AUTO_RESOLVABLE.contains(type);
    }

    /**
     * First 12 hex characters of the MD5 of {@code service.metric.type.severity.timestamp}. Surfaced
     * alerts are unique per {@code (service, type, severity)} inside the dedup window, so one
     * detection pass never reuses an id.
     */
    public static String alertId(String service, String metric, AnomalyType type, AlertSeverity severity,
                                 Instant createdAt) {
        String seed = service + "." + metric + "." + type.name() + "." + severity.name() + "." + createdAt.toEpochMilli();
        return DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8)).substring(0, ALERT_ID_LENGTH);
    }

    // ========== Private Methods ==========

    private static double impactMultiplier(AnomalyType type) {
        return switch (type) {
            case MEMORY_LEAK -> 1.5;
            case PERFORMANCE_DEGRADATION -> 2.0;
            default -> 1.3;
        };
    }

    private static String impactDescription(AnomalyType type) {
        return switch (type) {
            case PERFORMANCE_DEGRADATION -> "Users may experience slower response times";
            case RESOURCE_EXHAUSTION -> "Service may become unavailable due to resource limits";
            case ERROR_SPIKE -> "Increased error rates affecting user transactions";
            case LATENCY_INCREASE -> "Response times increasing and user experience degrading";
            case THROUGHPUT_DROP -> "Reduced capacity to handle incoming requests";
            case MEMORY_LEAK -> "Gradual memory exhaustion leading to service crashes";
            case CPU_SATURATION -> "Request processing slowing down under CPU pressure";
            case NETWORK_ISSUES -> "Connectivity problems affecting service communication";
            case DEPENDENCY_FAILURE -> "Failures cascading from downstream dependencies";
            case DATA_QUALITY_ISSUE -> "Monitoring accuracy reduced by irregular telemetry";
        };
    }

    private static List<String> playbook(AnomalyType type) {
        return switch (type) {
            case PERFORMANCE_DEGRADATION -> List.of(
                    "Review recent deployments for performance regressions",
                    "Check database query performance",
                    "Scale up service instances",
                    "Enable response caching");
            case RESOURCE_EXHAUSTION -> List.of(
                    "Scale up resources immediately",
                    "Identify resource-intensive processes",
                    "Review resource limits and quotas");
            case ERROR_SPIKE -> List.of(
                    "Check application logs for error patterns",
                    "Review recent code deployments",
                    "Verify downstream service health",
                    "Consider rolling back the latest deployment");
            case LATENCY_INCREASE -> List.of(
                    "Check downstream dependency latency",
                    "Review database connection pool usage",
                    "Analyze slow query logs",
                    "Check network connectivity");
            case THROUGHPUT_DROP -> List.of(
                    "Check load balancer configuration",
                    "Verify upstream traffic sources",
                    "Review rate limiting settings");
            case MEMORY_LEAK -> List.of(
                    "Analyze heap dumps for leaked objects",
                    "Schedule a rolling restart",
                    "Review recent changes to caching and object lifecycles");
            case CPU_SATURATION -> List.of(
                    "Scale out service instances",
                    "Profile CPU-intensive code paths",
                    "Review thread pool sizing");
            case NETWORK_ISSUES -> List.of(
                    "Check network connectivity and DNS resolution",
                    "Review connection pool settings",
                    "Verify firewall and security group rules");
            case DEPENDENCY_FAILURE -> List.of(
                    "Check dependency health endpoints",
                    "Open the circuit breaker for the failing dependency",
                    "Fail over to a secondary dependency");
            case DATA_QUALITY_ISSUE -> List.of(
                    "Verify the metric collection pipeline",
                    "Check for missing or delayed telemetry");
        };
    }
}
