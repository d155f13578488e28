package com.z254.butterfly.sentinel.alerting;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyResult;
import com.z254.butterfly.sentinel.detection.AnomalyType;
import com.z254.butterfly.sentinel.detection.AnomalyTypeClassifier;
import com.z254.butterfly.sentinel.forecast.CapacityForecast;
import com.z254.butterfly.sentinel.forecast.CapacityForecaster;
import com.z254.butterfly.sentinel.forecast.Forecast;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.AlertEventType;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Turns anomaly verdicts and capacity forecasts into deduplicated, correlated alerts.
 * <p>
 * Surfaced alerts are kept in a bounded recent buffer; repeats of the same
 * {@code (service, type, severity)} inside the dedup window come back flagged as suppressed
 * and are not buffered. Two or more surfaced alerts for one service inside the window form a
 * single {@link CorrelationRecord} per service.
 */
@Slf4j
@Component
public class AlertEngine {

    /**
     * Highest severity first, then highest score.
     */
    public static final Comparator<Alert> BY_SEVERITY = Comparator
            .comparing(Alert::getSeverity, Comparator.reverseOrder())
            .thenComparing(Alert::getAnomalyScore, Comparator.reverseOrder());

    static final double PREDICTIVE_BASE_SCORE = 0.7;

    private final AlertPolicy policy;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final AnomalyTypeClassifier typeClassifier;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;
    private final SentinelProperties.Alerting config;
    private final double anomalyThreshold;
    private final Duration step;

    private final Cache<DedupKey, String> surfacedKeys;
    private final Deque<Alert> recentAlerts = new ConcurrentLinkedDeque<>();
    private final Map<String, CorrelationRecord> correlations = new ConcurrentHashMap<>();

    public AlertEngine(SentinelProperties properties,
                       RootCauseAnalyzer rootCauseAnalyzer,
                       AnomalyTypeClassifier typeClassifier,
                       SentinelMetrics metrics,
                       SentinelStructuredLogger structuredLogger,
                       Clock clock) {
        this.config = properties.getAlerting();
        this.policy = new AlertPolicy(config);
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.typeClassifier = typeClassifier;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.anomalyThreshold = properties.getDetection().getAnomalyThreshold();
        this.step = properties.getForecast().getStep();

        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.surfacedKeys = Caffeine.newBuilder()
                .expireAfterWrite(config.getDedupWindow())
                .ticker(ticker)
                .build();
    }

    // ========== Alert Creation ==========

    /**
     * Build an alert for an anomalous verdict.
     *
     * @return empty when the verdict is not an anomaly or scores below the alert threshold;
     * otherwise the alert, flagged {@code suppressed} when it repeats a surfaced one
     */
    public Optional<Alert> evaluate(AnomalyResult result, MetricWindow window,
                                    Optional<Forecast> forecast, Double serviceHealthScore) {
        if (!result.anomaly() || result.score() < anomalyThreshold) {
            return Optional.empty();
        }
        AnomalyType type = result.anomalyType();
        AlertSeverity severity = policy.severity(result.score(), type);
        RootCause rootCause = rootCauseAnalyzer.analyze(window, type);

        double confidence = rootCause.hasSignificantCorrelations()
                ? Math.max(result.confidence(), rootCause.getConfidence())
                : result.confidence();

        Alert alert = buildAlert(window, type, severity, result.score(), confidence, AlertSource.ANOMALY,
                policy.timeToImpact(window, type, forecast, step), rootCause, serviceHealthScore);
        return Optional.of(surface(alert));
    }

    /**
     * Build a predictive alert when a capacity forecast reaches its limit inside the horizon.
     */
    public Optional<Alert> evaluatePredictive(CapacityForecast forecast, MetricWindow window,
                                              Double serviceHealthScore) {
        if (!forecast.isCapacityAtRisk()) {
            return Optional.empty();
        }
        Duration ttc = forecast.getTimeToCapacity();
        Duration horizon = step.multipliedBy(Math.max(1, forecast.getForecastPoints().size()));
        double ratio = Math.min(1.0, (double) ttc.toMillis() / horizon.toMillis());
        double score = PREDICTIVE_BASE_SCORE + (1.0 - PREDICTIVE_BASE_SCORE) * (1.0 - ratio);

        AnomalyType type = typeClassifier.classify(window);
        AlertSeverity severity = policy.severity(score, type);

        RootCause rootCause = rootCauseAnalyzer.analyze(window, type);
        List<String> factors = new ArrayList<>(rootCause.getContributingFactors());
        factors.add(0, String.format("%s projected to reach %.2f within %d min (%s forecast)",
                forecast.getMetricName(), forecast.getCapacityLimit(), ttc.toMinutes(), forecast.getMethod()));
        forecast.getSeasonalPatterns().forEach(pattern -> factors.add(String.format("Recurring %s at %s",
                pattern.kind().name().toLowerCase(Locale.ROOT).replace('_', ' '),
                CapacityForecaster.describeSlot(pattern))));
        rootCause.setContributingFactors(factors);

        Alert alert = buildAlert(window, type, severity, score, forecast.getConfidence(), AlertSource.FORECAST,
                ttc, rootCause, serviceHealthScore);
        return Optional.of(surface(alert));
    }

    // ========== Correlation ==========

    /**
     * Form or extend the correlation record of the alert's service when at least two surfaced
     * alerts share the window.
     */
    public Optional<CorrelationRecord> correlate(Alert alert) {
        if (alert.isSuppressed()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(config.getDedupWindow());
        List<Alert> concurrent = recentAlerts.stream()
                .filter(a -> a.getServiceName().equals(alert.getServiceName()))
                .filter(a -> !a.getCreatedAt().isBefore(cutoff))
                .toList();
        if (concurrent.size() < 2) {
            return Optional.empty();
        }

        boolean[] created = new boolean[1];
        CorrelationRecord record = correlations.compute(alert.getServiceName(), (service, existing) -> {
            boolean fresh = existing == null || existing.getUpdatedAt().isBefore(cutoff);
            created[0] = fresh;
            CorrelationRecord next = fresh
                    ? CorrelationRecord.builder()
                        .id("corr-" + UUID.randomUUID().toString().substring(0, 8))
                        .serviceName(service)
                        .correlationScore(config.getCorrelationScore())
                        .createdAt(now)
                        .build()
                    : copy(existing);
            for (Alert member : concurrent) {
                next.getAlertIds().add(member.getId());
                next.getAlertTypes().add(member.getType());
                if (member.getIncidentId() != null) {
                    next.getIncidentIds().add(member.getIncidentId());
                }
                if (next.getMaxSeverity() == null || member.getSeverity().compareTo(next.getMaxSeverity()) > 0) {
                    next.setMaxSeverity(member.getSeverity());
                }
            }
            next.setRootCause(synthesizeRootCause(service, concurrent));
            next.setUpdatedAt(now);
            return next;
        });

        if (created[0]) {
            metrics.recordCorrelationCreated();
        }
        structuredLogger.logAlertEvent(alert.getId(), alert.getServiceName(), AlertEventType.CORRELATED,
                "Alerts correlated", Map.of(
                        "correlationId", record.getId(),
                        "alertCount", record.getAlertIds().size(),
                        "types", record.getAlertTypes().toString()));
        return Optional.of(record);
    }

    /**
     * Record the incident an alert was promoted to, on the alert and on any correlation
     * record that references it.
     */
    public void linkIncident(Alert alert, String incidentId) {
        alert.setIncidentId(incidentId);
        correlations.computeIfPresent(alert.getServiceName(), (service, existing) -> {
            if (!existing.getAlertIds().contains(alert.getId())) {
                return existing;
            }
            CorrelationRecord next = copy(existing);
            next.getIncidentIds().add(incidentId);
            return next;
        });
    }

    // ========== Maintenance ==========

    /**
     * Drop expired dedup entries and correlation records, and compact the recent buffer to
     * the latest alert per {@code (service, type)} once it exceeds its bound.
     */
    public int maintain() {
        surfacedKeys.cleanUp();
        Instant cutoff = clock.instant().minus(config.getDedupWindow());
        correlations.values().removeIf(record -> record.getUpdatedAt().isBefore(cutoff));

        if (recentAlerts.size() <= config.getMaxBufferedAlerts()) {
            return 0;
        }
        // Decide on a snapshot and remove by identity; alerts surfaced meanwhile stay
        List<Alert> snapshot = new ArrayList<>(recentAlerts);
        Map<String, Alert> latest = new HashMap<>();
        for (Alert alert : snapshot) {
            latest.merge(alert.getServiceName() + "|" + alert.getType(), alert,
                    (a, b) -> b.getCreatedAt().isBefore(a.getCreatedAt()) ? a : b);
        }
        Set<Alert> stale = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Alert alert : snapshot) {
            if (latest.get(alert.getServiceName() + "|" + alert.getType()) != alert) {
                stale.add(alert);
            }
        }
        recentAlerts.removeIf(stale::contains);

        log.info("Compacted alert buffer: evicted={}, retained={}", stale.size(), recentAlerts.size());
        return stale.size();
    }

    // ========== Queries ==========

    /**
     * Alerts surfaced inside the dedup window, most severe first.
     */
    public List<Alert> getActiveAlerts(int limit) {
        Instant cutoff = clock.instant().minus(config.getDedupWindow());
        return recentAlerts.stream()
                .filter(alert -> !alert.getCreatedAt().isBefore(cutoff))
                .sorted(BY_SEVERITY.thenComparing(Alert::getCreatedAt, Comparator.reverseOrder()))
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Newest surfaced alerts first.
     */
    public List<Alert> getRecentAlerts(int limit) {
        List<Alert> newestFirst = new ArrayList<>(recentAlerts);
        Collections.reverse(newestFirst);
        return newestFirst.stream().limit(Math.max(0, limit)).toList();
    }

    public List<Alert> getRecentAlerts() {
        return getRecentAlerts(config.getRecentAlertsLimit());
    }

    public Optional<Alert> getAlert(String alertId) {
        return recentAlerts.stream().filter(alert -> alert.getId().equals(alertId)).findFirst();
    }

    public List<CorrelationRecord> getCorrelations() {
        return correlations.values().stream()
                .sorted(Comparator.comparing(CorrelationRecord::getUpdatedAt).reversed())
                .toList();
    }

    public Optional<CorrelationRecord> getCorrelation(String serviceName) {
        return Optional.ofNullable(correlations.get(serviceName));
    }

    public int bufferedAlerts() {
        return recentAlerts.size();
    }

    /**
     * Order a cycle's alerts for dispatch.
     */
    public static List<Alert> bySeverity(Collection<Alert> alerts) {
        return alerts.stream().sorted(BY_SEVERITY).toList();
    }

    // ========== Private Methods ==========

    private Alert buildAlert(MetricWindow window, AnomalyType type, AlertSeverity severity, double score,
                             double confidence, AlertSource source, Duration timeToImpact,
                             RootCause rootCause, Double serviceHealthScore) {
        Instant now = clock.instant();
        return Alert.builder()
                .id(AlertPolicy.alertId(window.serviceName(), window.metricName(), type, severity, now))
                .serviceName(window.serviceName())
                .metricName(window.metricName())
                .type(type)
                .severity(severity)
                .source(source)
                .anomalyScore(score)
                .confidence(confidence)
                .predictedImpact(policy.predictedImpact(type, severity))
                .timeToImpact(timeToImpact)
                .recommendedActions(policy.recommendations(window.serviceName(), type, severity))
                .autoResolvable(policy.isAutoResolvable(type, severity))
                .rootCause(rootCause)
                .serviceHealthScore(serviceHealthScore)
                .createdAt(now)
                .build();
    }

    private Alert surface(Alert alert) {
        DedupKey key = new DedupKey(alert.getServiceName(), alert.getType(), alert.getSeverity());
        String previous = surfacedKeys.asMap().putIfAbsent(key, alert.getId());
        if (previous != null) {
            alert.setSuppressed(true);
            metrics.recordAlertSuppressed();
            structuredLogger.logAlertEvent(alert.getId(), alert.getServiceName(), AlertEventType.SUPPRESSED,
                    "Duplicate alert suppressed", Map.of("duplicateOf", previous, "type", alert.getType().name(),
                            "severity", alert.getSeverity().name()));
            return alert;
        }

        recentAlerts.addLast(alert);
        metrics.recordAlertRaised(alert.getSeverity().name());
        structuredLogger.logAlertEvent(alert.getId(), alert.getServiceName(), AlertEventType.RAISED,
                alert.getSeverity() + " " + alert.getType().getDisplayName() + " on " + alert.getMetricName(),
                Map.of(
                        "type", alert.getType().name(),
                        "severity", alert.getSeverity().name(),
                        "source", alert.getSource().name(),
                        "score", String.format("%.3f", alert.getAnomalyScore()),
                        "timeToImpactSec", alert.getTimeToImpact().toSeconds()));
        return alert;
    }

    private static String synthesizeRootCause(String service, List<Alert> alerts) {
        Alert lead = alerts.stream().min(BY_SEVERITY).orElseThrow();
        String types = alerts.stream()
                .map(a -> a.getType().getDisplayName())
                .distinct()
                .collect(Collectors.joining(", "));
        return String.format("Concurrent anomalies on %s (%s) likely share a root cause; most severe: %s on %s",
                service, types, lead.getType().getDisplayName().toLowerCase(Locale.ROOT), lead.getMetricName());
    }

    private static CorrelationRecord copy(CorrelationRecord source) {
        return CorrelationRecord.builder()
                .id(source.getId())
                .serviceName(source.getServiceName())
                .alertIds(new LinkedHashSet<>(source.getAlertIds()))
                .incidentIds(new LinkedHashSet<>(source.getIncidentIds()))
                .alertTypes(new LinkedHashSet<>(source.getAlertTypes()))
                .maxSeverity(source.getMaxSeverity())
                .rootCause(source.getRootCause())
                .correlationScore(source.getCorrelationScore())
                .createdAt(source.getCreatedAt())
                .updatedAt(source.getUpdatedAt())
                .build();
    }

    private record DedupKey(String serviceName, AnomalyType type, AlertSeverity severity) {
    }
}
