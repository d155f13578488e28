package com.z254.butterfly.sentinel.domain.service;

import com.z254.butterfly.sentinel.alerting.AlertSeverity;
import com.z254.butterfly.sentinel.common.ErrorKind;
import com.z254.butterfly.sentinel.domain.model.*;
import com.z254.butterfly.sentinel.domain.repository.IncidentRepository;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.IncidentEventType;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Central service for managing incident lifecycle state.
 * <p>
 * At most one active incident exists per {@code (service, type)}; a new detection for an
 * open pair is merged into it. The active index is a concurrent map so registrations for
 * different pairs never contend.
 */
@Service
public class IncidentService {

    private static final List<IncidentStatus> ACTIVE_STATUSES = Arrays.stream(IncidentStatus.values())
            .filter(status -> !status.isTerminal())
            .toList();

    private final IncidentRepository incidentRepository;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    private final Map<ActiveKey, String> activeIndex = new ConcurrentHashMap<>();

    public IncidentService(IncidentRepository incidentRepository,
                           SentinelMetrics metrics,
                           SentinelStructuredLogger structuredLogger,
                           Clock clock) {
        this.incidentRepository = incidentRepository;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Register a newly classified incident, or merge it into the open incident for the same
     * service and type.
     */
    public Registration register(Incident draft) {
        ActiveKey key = new ActiveKey(draft.getServiceName(), draft.getType());
        boolean[] merged = new boolean[1];

        String incidentId = activeIndex.compute(key, (k, existingId) -> {
            Optional<Incident> existing = Optional.ofNullable(existingId)
                    .flatMap(incidentRepository::findById)
                    .filter(Incident::isActive);
            if (existing.isPresent()) {
                mergeInto(existing.get(), draft);
                merged[0] = true;
                return existingId;
            }
            return create(draft).getId();
        });

        Incident incident = incidentRepository.findById(incidentId).orElseThrow();
        if (merged[0]) {
            metrics.recordIncidentMerged();
            structuredLogger.logIncidentEvent(incidentId, IncidentEventType.MERGED,
                    "Detection merged into open incident", Map.of(
                            "reason", ErrorKind.DUPLICATE_INCIDENT.name(),
                            "type", incident.getType().name(),
                            "relatedAlerts", incident.getRelatedAlertIds().size()));
        }
        return new Registration(incident, merged[0]);
    }

    /**
     * Move an active incident to a new status. Terminal states release the
     * {@code (service, type)} slot.
     */
    public Optional<Incident> transition(String incidentId, IncidentStatus next, String description) {
        return incidentRepository.findById(incidentId).map(incident -> {
            Instant now = clock.instant();
            synchronized (incident) {
                if (incident.getStatus().isTerminal()) {
                    throw new IllegalStateException("Incident " + incidentId + " is already " + incident.getStatus());
                }
                incident.transitionTo(next, description, now);
                incidentRepository.save(incident);
            }
            if (next.isTerminal()) {
                activeIndex.remove(new ActiveKey(incident.getServiceName(), incident.getType()), incidentId);
                recordTerminal(incident, description);
            } else {
                structuredLogger.logIncidentEvent(incidentId,
                        next == IncidentStatus.RESOLVING ? IncidentEventType.RESOLVING : IncidentEventType.CLASSIFIED,
                        description);
            }
            return incident;
        });
    }

    /**
     * Escalate to a human operator, recording why.
     */
    public Optional<Incident> escalate(String incidentId, String reason) {
        incidentRepository.findById(incidentId).ifPresent(incident -> {
            synchronized (incident) {
                incident.setEscalationReason(reason);
                incident.addTimelineEvent(Incident.TimelineEventType.ESCALATED, reason, clock.instant());
            }
        });
        return transition(incidentId, IncidentStatus.ESCALATED, reason);
    }

    /**
     * Record the escalation reason on an incident that already reached a terminal state.
     */
    public Optional<Incident> annotateEscalation(String incidentId, String reason) {
        return incidentRepository.findById(incidentId).map(incident -> {
            synchronized (incident) {
                incident.setEscalationReason(reason);
                incident.addTimelineEvent(Incident.TimelineEventType.ESCALATED, reason, clock.instant());
                incidentRepository.save(incident);
            }
            metrics.recordEscalationAfterFailure(incident.getSeverity().name());
            return incident;
        });
    }

    public void attachPlan(String incidentId, List<ActionType> actions) {
        incidentRepository.findById(incidentId).ifPresent(incident -> {
            synchronized (incident) {
                incident.setRecommendedActions(new ArrayList<>(actions));
                incidentRepository.save(incident);
            }
        });
    }

    /**
     * Append an executed action and its audit record.
     */
    public void recordAttempt(String incidentId, ActionType action, Incident.ResolutionRecord record) {
        incidentRepository.findById(incidentId).ifPresent(incident -> {
            synchronized (incident) {
                incident.getAttemptedActions().add(action);
                incident.addResolutionRecord(record);
                incident.addTimelineEvent(Incident.TimelineEventType.ACTION_EXECUTED,
                        action.code() + (record.isSuccess() ? " succeeded" : " failed"), record.getTimestamp());
                incidentRepository.save(incident);
            }
        });
    }

    public void recordRollback(String incidentId, Incident.ResolutionRecord record) {
        incidentRepository.findById(incidentId).ifPresent(incident -> {
            synchronized (incident) {
                incident.addResolutionRecord(record);
                incident.addTimelineEvent(Incident.TimelineEventType.ROLLBACK_EXECUTED,
                        record.getAction() + (record.isSuccess() ? " succeeded" : " failed"), record.getTimestamp());
                incidentRepository.save(incident);
            }
        });
    }

    public void linkAlert(String incidentId, String alertId) {
        incidentRepository.findById(incidentId).ifPresent(incident -> {
            synchronized (incident) {
                if (!incident.getRelatedAlertIds().contains(alertId)) {
                    incident.getRelatedAlertIds().add(alertId);
                }
                incidentRepository.save(incident);
            }
        });
    }

    public Optional<Incident> getIncident(String incidentId) {
        return incidentRepository.findById(incidentId);
    }

    public Optional<Incident> findActive(String service, IncidentType type) {
        return Optional.ofNullable(activeIndex.get(new ActiveKey(service, type)))
                .flatMap(incidentRepository::findById)
                .filter(Incident::isActive);
    }

    public List<Incident> getActiveIncidents() {
        return incidentRepository.findByStatusIn(ACTIVE_STATUSES).stream()
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    public List<Incident> listIncidents(IncidentStatus status, String service) {
        return incidentRepository.findAll().stream()
                .filter(incident -> status == null || incident.getStatus() == status)
                .filter(incident -> service == null || service.equals(incident.getServiceName()))
                .sorted(Comparator.comparing(Incident::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    /**
     * Incidents that reached a terminal state, used as training history.
     */
    public List<Incident> getClosedIncidents() {
        return incidentRepository.findAll().stream()
                .filter(incident -> incident.getStatus().isTerminal())
                .collect(Collectors.toList());
    }

    public int activeCount() {
        return activeIndex.size();
    }

    /**
     * {@code inc_} followed by 12 hex characters of the MD5 of service, type and time.
     */
    static String incidentId(String service, IncidentType type, Instant at) {
        String seed = service + "_" + type.code() + "_" + at.toString() + "_" + System.nanoTime();
        return "inc_" + DigestUtils.md5DigestAsHex(seed.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
    }

    // ========== Private Methods ==========

    private Incident create(Incident draft) {
        Instant now = clock.instant();
        draft.setId(incidentId(draft.getServiceName(), draft.getType(), now));
        draft.setStatus(IncidentStatus.DETECTED);
        draft.setCreatedAt(now);
        draft.setUpdatedAt(now);
        if (draft.getDescription() == null) {
            draft.setDescription(draft.getType().code() + " detected in " + draft.getServiceName());
        }
        draft.addTimelineEvent(Incident.TimelineEventType.CREATED, draft.getDescription(), now);
        incidentRepository.save(draft);

        metrics.recordIncidentCreated(draft.getSeverity().name());
        structuredLogger.logIncidentEvent(draft.getId(), IncidentEventType.CREATED, draft.getDescription(), Map.of(
                "service", draft.getServiceName(),
                "type", draft.getType().name(),
                "severity", draft.getSeverity().name(),
                "confidence", String.format("%.2f", draft.getClassificationConfidence())));
        return draft;
    }

    private void mergeInto(Incident existing, Incident draft) {
        Instant now = clock.instant();
        synchronized (existing) {
            for (String alertId : draft.getRelatedAlertIds()) {
                if (!existing.getRelatedAlertIds().contains(alertId)) {
                    existing.getRelatedAlertIds().add(alertId);
                }
            }
            if (draft.getMetricsSnapshot() != null) {
                existing.setMetricsSnapshot(draft.getMetricsSnapshot());
            }
            if (draft.getSeverity() != null && draft.getSeverity().compareTo(existing.getSeverity()) > 0) {
                existing.setSeverity(draft.getSeverity());
            }
            AlertSeverity peak = draft.getPeakAlertSeverity();
            if (peak != null && (existing.getPeakAlertSeverity() == null
                    || peak.compareTo(existing.getPeakAlertSeverity()) > 0)) {
                existing.setPeakAlertSeverity(peak);
            }
            existing.addTimelineEvent(Incident.TimelineEventType.MERGED, "Duplicate detection merged", now);
            incidentRepository.save(existing);
        }
    }

    private void recordTerminal(Incident incident, String description) {
        String severity = incident.getSeverity().name();
        switch (incident.getStatus()) {
            case RESOLVED -> {
                Duration mttr = incident.getMttrMs() != null ? Duration.ofMillis(incident.getMttrMs()) : Duration.ZERO;
                metrics.recordIncidentResolved(severity, mttr);
                structuredLogger.logIncidentEvent(incident.getId(), IncidentEventType.RESOLVED, description,
                        Map.of("mttrMs", mttr.toMillis()));
            }
            case ESCALATED -> {
                metrics.recordIncidentEscalated(severity);
                structuredLogger.logIncidentEvent(incident.getId(), IncidentEventType.ESCALATED, description);
            }
            case FAILED -> {
                metrics.recordIncidentFailed(severity);
                structuredLogger.logIncidentEvent(incident.getId(), IncidentEventType.FAILED, description);
            }
            default -> {
            }
        }
    }

    /**
     * Outcome of {@link #register(Incident)}.
     *
     * @param merged true when the detection was a duplicate of an open incident
     */
    public record Registration(Incident incident, boolean merged) {
    }

    private record ActiveKey(String serviceName, IncidentType type) {
    }
}
