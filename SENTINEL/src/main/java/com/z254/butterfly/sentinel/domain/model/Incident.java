package com.z254.butterfly.sentinel.domain.model;

import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incident entity: one operational problem on one service, from detection to a terminal
 * state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    private String id;

    private String serviceName;

    private IncidentType type;

    /** Human-readable summary */
    private String description;

    private IncidentSeverity severity;

    /** Highest severity among the alerts that drove or merged into this incident */
    private AlertSeverity peakAlertSeverity;

    @Builder.Default
    private IncidentStatus status = IncidentStatus.DETECTED;

    /** Metric values at detection, refreshed on merge */
    private IncidentMetrics metricsSnapshot;

    private IncidentContext context;

    private double classificationConfidence;

    private ClassificationMethod classificationMethod;

    @Builder.Default
    private List<ActionType> recommendedActions = new ArrayList<>();

    /** Actions executed so far, a prefix of the active workflow's plan */
    @Builder.Default
    private List<ActionType> attemptedActions = new ArrayList<>();

    @Builder.Default
    private List<String> relatedAlertIds = new ArrayList<>();

    /** Correlation record the incident was opened from, if any */
    private String correlationId;

    @Builder.Default
    private List<ResolutionRecord> resolutionHistory = new ArrayList<>();

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    private String escalationReason;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant resolvedAt;

    /** Mean time to resolution (ms) */
    private Long mttrMs;

    /**
     * Move to the given status and record it on the timeline.
     */
    public void transitionTo(IncidentStatus next, String description, Instant at) {
        this.status = next;
        addTimelineEvent(TimelineEventType.STATUS_CHANGED, next + ": " + description, at);
        if (next == IncidentStatus.RESOLVED) {
            this.resolvedAt = at;
            if (createdAt != null) {
                this.mttrMs = Duration.between(createdAt, at).toMillis();
            }
        }
    }

    /**
     * Add a timeline event.
     */
    public void addTimelineEvent(TimelineEventType type, String description, Instant at) {
        timeline.add(TimelineEvent.builder()
                .timestamp(at)
                .type(type)
                .description(description)
                .build());
        this.updatedAt = at;
    }

    public void addResolutionRecord(ResolutionRecord record) {
        resolutionHistory.add(record);
        this.updatedAt = record.getTimestamp();
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    /**
     * Whether an unresolved outcome must reach a human: critical incidents, or incidents
     * driven by critical or emergency alerts.
     */
    public boolean requiresEscalationWhenUnresolved() {
        return severity == IncidentSeverity.CRITICAL
                || (peakAlertSeverity != null && peakAlertSeverity.isCriticalOrAbove());
    }

    /**
     * Severity used to pick notification channels.
     */
    public AlertSeverity notificationSeverity() {
        AlertSeverity fromIncident = severity.toAlertSeverity();
        if (peakAlertSeverity == null) {
            return fromIncident;
        }
        return peakAlertSeverity.compareTo(fromIncident) > 0 ? peakAlertSeverity : fromIncident;
    }

    public Duration age(Instant now) {
        return createdAt == null ? Duration.ZERO : Duration.between(createdAt, now);
    }

    /**
     * Timeline event types.
     */
    public enum TimelineEventType {
        CREATED,
        MERGED,
        CLASSIFIED,
        STATUS_CHANGED,
        ACTION_EXECUTED,
        ROLLBACK_EXECUTED,
        ESCALATED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelineEvent {
        private Instant timestamp;
        private TimelineEventType type;
        private String description;
    }

    /**
     * Audit entry for one executed, verified or rolled back step.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResolutionRecord {
        private String workflowId;
        private String action;
        private Instant timestamp;
        private boolean success;
        private String message;
        @Builder.Default
        private Map<String, Double> metricsBefore = new HashMap<>();
        @Builder.Default
        private Map<String, Double> metricsAfter = new HashMap<>();
    }
}
