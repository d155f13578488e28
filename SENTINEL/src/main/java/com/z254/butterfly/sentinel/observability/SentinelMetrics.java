package com.z254.butterfly.sentinel.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for SENTINEL.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Telemetry intake (ingested, dropped, rejected)</li>
 *     <li>Detection and forecasting (anomalies, model availability, latency)</li>
 *     <li>Alerting (raised by severity, suppressed, correlated)</li>
 *     <li>Incident lifecycle (auto-resolved vs escalated, MTTR by severity)</li>
 *     <li>Remediation actions and scaling decisions</li>
 * </ul>
 */
@Component
public class SentinelMetrics {

    private final MeterRegistry meterRegistry;

    // Telemetry metrics
    @Getter
    private final Counter samplesIngested;
    @Getter
    private final Counter samplesDropped;
    @Getter
    private final Counter samplesRejected;
    private final AtomicInteger ingestionQueueDepth;

    // Detection metrics
    @Getter
    private final Counter anomaliesDetected;
    @Getter
    private final Counter detectionErrors;
    @Getter
    private final Counter modelsTrained;
    private final Timer forecastLatency;

    // Alert metrics
    @Getter
    private final Counter alertsRaised;
    @Getter
    private final Counter alertsSuppressed;
    @Getter
    private final Counter correlationsCreated;

    // Incident metrics
    @Getter
    private final Counter incidentsCreated;
    @Getter
    private final Counter incidentsMerged;
    private final AtomicInteger activeIncidents;
    private final AtomicInteger activeWorkflows;
    private final Timer workflowDuration;

    // Action metrics
    @Getter
    private final Counter actionsRolledBack;

    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> mttrTimers = new ConcurrentHashMap<>();

    public SentinelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize telemetry metrics
        this.samplesIngested = Counter.builder("sentinel.telemetry.samples.ingested")
                .description("Samples applied to the telemetry buffer")
                .register(meterRegistry);
        this.samplesDropped = Counter.builder("sentinel.telemetry.samples.dropped")
                .description("Samples dropped by the ingestion queue under overload")
                .register(meterRegistry);
        this.samplesRejected = Counter.builder("sentinel.telemetry.samples.rejected")
                .description("Malformed samples rejected at intake")
                .register(meterRegistry);
        this.ingestionQueueDepth = meterRegistry.gauge("sentinel.telemetry.queue.depth", new AtomicInteger(0));

        // Initialize detection metrics
        this.anomaliesDetected = Counter.builder("sentinel.detection.anomalies")
                .description("Windows judged anomalous")
                .register(meterRegistry);
        this.detectionErrors = Counter.builder("sentinel.detection.errors")
                .description("Detection or scoring failures skipped by the pipeline")
                .register(meterRegistry);
        this.modelsTrained = Counter.builder("sentinel.detection.models.trained")
                .description("Ensemble models trained")
                .register(meterRegistry);
        this.forecastLatency = Timer.builder("sentinel.forecast.latency")
                .description("Forecast computation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        // Initialize alert metrics
        this.alertsRaised = Counter.builder("sentinel.alerts.raised")
                .description("Alerts surfaced")
                .register(meterRegistry);
        this.alertsSuppressed = Counter.builder("sentinel.alerts.suppressed")
                .description("Alerts suppressed as duplicates")
                .register(meterRegistry);
        this.correlationsCreated = Counter.builder("sentinel.alerts.correlations")
                .description("Correlation records created")
                .register(meterRegistry);

        // Initialize incident metrics
        this.incidentsCreated = Counter.builder("sentinel.incidents.created")
                .description("Incidents opened")
                .register(meterRegistry);
        this.incidentsMerged = Counter.builder("sentinel.incidents.merged")
                .description("Detections merged into an open incident")
                .register(meterRegistry);
        this.activeIncidents = meterRegistry.gauge("sentinel.incidents.active", new AtomicInteger(0));
        this.activeWorkflows = meterRegistry.gauge("sentinel.workflows.active", new AtomicInteger(0));
        this.workflowDuration = Timer.builder("sentinel.workflows.duration")
                .description("Resolution workflow duration")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);

        this.actionsRolledBack = Counter.builder("sentinel.actions.rolled_back")
                .description("Compensating actions executed")
                .register(meterRegistry);
    }

    // ========== Telemetry Methods ==========

    public void recordSamplesIngested(int count) {
        samplesIngested.increment(count);
    }

    public void recordSampleDropped() {
        samplesDropped.increment();
    }

    public void recordSampleRejected() {
        samplesRejected.increment();
    }

    public void setIngestionQueueDepth(int depth) {
        ingestionQueueDepth.set(depth);
    }

    // ========== Detection Methods ==========

    public void recordAnomalyDetected(String anomalyType) {
        anomaliesDetected.increment();
        taggedCounter("sentinel.detection.anomalies.by_type", "type", anomalyType).increment();
    }

    public void recordDetectionError() {
        detectionErrors.increment();
    }

    public void recordModelTrained() {
        modelsTrained.increment();
    }

    public Timer.Sample startForecastTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordForecastCompleted(Timer.Sample sample, String method) {
        sample.stop(forecastLatency);
        taggedCounter("sentinel.forecast.completed", "method", method).increment();
    }

    public void recordForecastUnavailable(String reason) {
        taggedCounter("sentinel.forecast.unavailable", "reason", reason).increment();
    }

    // ========== Alert Methods ==========

    public void recordAlertRaised(String severity) {
        alertsRaised.increment();
        taggedCounter("sentinel.alerts.raised.by_severity", "severity", severity).increment();
    }

    public void recordAlertSuppressed() {
        alertsSuppressed.increment();
    }

    public void recordCorrelationCreated() {
        correlationsCreated.increment();
    }

    // ========== Incident Methods ==========

    public void recordIncidentCreated(String severity) {
        incidentsCreated.increment();
        activeIncidents.incrementAndGet();
        taggedCounter("sentinel.incidents.created.by_severity", "severity", severity).increment();
    }

    public void recordIncidentMerged() {
        incidentsMerged.increment();
    }

    public void recordIncidentResolved(String severity, Duration mttr) {
        activeIncidents.decrementAndGet();
        taggedCounter("sentinel.incidents.auto_resolved", "severity", severity).increment();
        mttrTimers.computeIfAbsent(severity, sev ->
                Timer.builder("sentinel.incidents.mttr")
                        .tag("severity", sev)
                        .description("Mean time to automated resolution")
                        .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                        .register(meterRegistry))
                .record(mttr);
    }

    public void recordIncidentEscalated(String severity) {
        activeIncidents.decrementAndGet();
        taggedCounter("sentinel.incidents.escalated", "severity", severity).increment();
    }

    /**
     * Escalation of an incident that already left the active set.
     */
    public void recordEscalationAfterFailure(String severity) {
        taggedCounter("sentinel.incidents.escalated", "severity", severity).increment();
    }

    public void recordIncidentFailed(String severity) {
        activeIncidents.decrementAndGet();
        taggedCounter("sentinel.incidents.failed", "severity", severity).increment();
    }

    // ========== Workflow Methods ==========

    public Timer.Sample startWorkflowTimer() {
        activeWorkflows.incrementAndGet();
        return Timer.start(meterRegistry);
    }

    public void recordWorkflowFinished(Timer.Sample sample, String outcome) {
        sample.stop(workflowDuration);
        activeWorkflows.decrementAndGet();
        taggedCounter("sentinel.workflows.completed", "outcome", outcome).increment();
    }

    public void recordActionExecuted(String actionType, boolean success) {
        taggedCounter(success ? "sentinel.actions.succeeded" : "sentinel.actions.failed",
                "action_type", actionType).increment();
    }

    public void recordActionRolledBack() {
        actionsRolledBack.increment();
    }

    // ========== Scaling / Notification Methods ==========

    public void recordScalingDecision(String direction) {
        taggedCounter("sentinel.scaling.decisions", "direction", direction).increment();
    }

    public void recordScalingSuppressed(String reason) {
        taggedCounter("sentinel.scaling.suppressed", "reason", reason).increment();
    }

    public void recordNotification(String channel, boolean delivered) {
        taggedCounter(delivered ? "sentinel.notifications.delivered" : "sentinel.notifications.failed",
                "channel", channel).increment();
    }

    private Counter taggedCounter(String name, String tagKey, String tagValue) {
        return taggedCounters.computeIfAbsent(name + '|' + tagValue, key ->
                Counter.builder(name)
                        .tag(tagKey, tagValue)
                        .register(meterRegistry));
    }
}
