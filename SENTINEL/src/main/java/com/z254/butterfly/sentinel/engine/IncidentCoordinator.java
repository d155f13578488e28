package com.z254.butterfly.sentinel.engine;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertEngine;
import com.z254.butterfly.sentinel.alerting.CorrelationRecord;
import com.z254.butterfly.sentinel.classification.Classification;
import com.z254.butterfly.sentinel.classification.IncidentClassifier;
import com.z254.butterfly.sentinel.classification.ResolutionPlan;
import com.z254.butterfly.sentinel.classification.ResolutionPlanner;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentStatus;
import com.z254.butterfly.sentinel.domain.service.DeploymentRegistry;
import com.z254.butterfly.sentinel.domain.service.IncidentService;
import com.z254.butterfly.sentinel.resolution.ResolutionExecutor;
import com.z254.butterfly.sentinel.resolution.ResolutionResult;
import com.z254.butterfly.sentinel.resolution.WorkflowAlreadyActiveException;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Turns surfaced alerts into incidents and hands new incidents to the resolution executor.
 */
@Slf4j
@Component
public class IncidentCoordinator {

    static final int PEAK_START_HOUR = 9;
    static final int PEAK_END_HOUR = 17;
    static final double SPIKE_RATIO = 1.5;
    static final double DECLINE_RATIO = 0.5;
    static final int LOAD_WINDOW = 20;

    private final IncidentClassifier classifier;
    private final ResolutionPlanner planner;
    private final IncidentService incidentService;
    private final DeploymentRegistry deploymentRegistry;
    private final ResolutionExecutor resolutionExecutor;
    private final AlertEngine alertEngine;
    private final TelemetryBuffer buffer;
    private final SentinelProperties properties;
    private final Clock clock;

    public IncidentCoordinator(IncidentClassifier classifier,
                               ResolutionPlanner planner,
                               IncidentService incidentService,
                               DeploymentRegistry deploymentRegistry,
                               ResolutionExecutor resolutionExecutor,
                               AlertEngine alertEngine,
                               TelemetryBuffer buffer,
                               SentinelProperties properties,
                               Clock clock) {
        this.classifier = classifier;
        this.planner = planner;
        this.incidentService = incidentService;
        this.deploymentRegistry = deploymentRegistry;
        this.resolutionExecutor = resolutionExecutor;
        this.alertEngine = alertEngine;
        this.buffer = buffer;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Open or extend the incident an alert points to.
     *
     * @return the incident, or empty when the alert is suppressed, below the promotion
     * severity, or no detection condition holds for the service
     */
    public Optional<Incident> promote(Alert alert) {
        if (alert.isSuppressed()
                || !alert.getSeverity().isAtLeast(properties.getAlerting().getIncidentSeverityThreshold())) {
            return Optional.empty();
        }
        String service = alert.getServiceName();
        IncidentMetrics snapshot = IncidentMetrics.fromLatest(buffer.latestValues(service), clock.instant());
        IncidentContext context = buildContext(service, List.of(alert.getId()));

        Optional<Classification> classification = classifier.classify(snapshot, context, alert);
        if (classification.isEmpty()) {
            log.debug("Alert {} on {} matches no detection condition, not promoted", alert.getId(), service);
            return Optional.empty();
        }

        Incident draft = draft(service, classification.get(), snapshot, context);
        draft.setPeakAlertSeverity(alert.getSeverity());
        draft.getRelatedAlertIds().add(alert.getId());

        Incident incident = open(draft);
        alertEngine.linkIncident(alert, incident.getId());
        return Optional.of(incident);
    }

    /**
     * Open an incident for a correlation record none of whose alerts reached an incident.
     */
    public Optional<Incident> promote(CorrelationRecord record) {
        if (record.hasIncident()) {
            return Optional.empty();
        }
        String service = record.getServiceName();
        IncidentMetrics snapshot = IncidentMetrics.fromLatest(buffer.latestValues(service), clock.instant());
        IncidentContext context = buildContext(service, new ArrayList<>(record.getAlertIds()));

        Optional<Classification> classification = classifier.classify(snapshot, context);
        if (classification.isEmpty()) {
            return Optional.empty();
        }

        Incident draft = draft(service, classification.get(), snapshot, context);
        draft.setPeakAlertSeverity(record.getMaxSeverity());
        draft.setCorrelationId(record.getId());
        draft.setDescription(record.getRootCause());
        draft.getRelatedAlertIds().addAll(record.getAlertIds());

        Incident incident = open(draft);
        for (String alertId : record.getAlertIds()) {
            alertEngine.getAlert(alertId).ifPresent(alert -> alertEngine.linkIncident(alert, incident.getId()));
        }
        return Optional.of(incident);
    }

    /**
     * Context of the service right now: deployments, load shape and time of day.
     */
    public IncidentContext buildContext(String service, List<String> relatedAlerts) {
        Instant now = clock.instant();
        ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
        int hour = utc.getHour();
        DayOfWeek day = utc.getDayOfWeek();

        return IncidentContext.builder()
                .serviceVersion(deploymentRegistry.currentVersion(service).orElse("unknown"))
                .recentDeployments(new ArrayList<>(deploymentRegistry.recentDeployments(service,
                        properties.getResolution().getRecentDeploymentWindow(), now)))
                .relatedAlerts(new ArrayList<>(relatedAlerts))
                .loadPattern(loadPattern(service))
                .timeOfDay(hour >= PEAK_START_HOUR && hour <= PEAK_END_HOUR ? "peak" : "off_peak")
                .dayOfWeek(day.getDisplayName(TextStyle.FULL, Locale.ROOT).toLowerCase(Locale.ROOT))
                .build();
    }

    // ========== Private Methods ==========

    private Incident draft(String service, Classification classification, IncidentMetrics snapshot,
                           IncidentContext context) {
        return Incident.builder()
                .serviceName(service)
                .type(classification.type())
                .severity(classification.severity())
                .metricsSnapshot(snapshot)
                .context(context)
                .classificationConfidence(classification.confidence())
                .classificationMethod(classification.method())
                .build();
    }

    /**
     * Register the draft; a new incident is classified, planned and submitted for
     * resolution, a merged duplicate is returned as is.
     */
    private Incident open(Incident draft) {
        IncidentService.Registration registration = incidentService.register(draft);
        Incident incident = registration.incident();
        if (registration.merged()) {
            return incident;
        }

        incidentService.transition(incident.getId(), IncidentStatus.CLASSIFYING, String.format(
                "Classified as %s (%s, confidence %.2f)", incident.getType().code(),
                incident.getClassificationMethod(), incident.getClassificationConfidence()));
        ResolutionPlan plan = planner.plan(incident);
        incidentService.attachPlan(incident.getId(), plan.actions());

        try {
            CompletableFuture<ResolutionResult> workflow = resolutionExecutor.submit(incident, plan);
            workflow.whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Resolution of incident {} ended abnormally: {}", incident.getId(), error.getMessage());
                } else if (result.isRequiresHumanReview()) {
                    log.info("Incident {} needs human review: status={}, lessons={}",
                            incident.getId(), result.getFinalStatus(), result.getLessonsLearned());
                }
            });
        } catch (WorkflowAlreadyActiveException e) {
            log.debug("Skipping resolution submit: {}", e.getMessage());
        }
        return incident;
    }

    /**
     * Spike when the newest load sample is well above the recent mean, declining when well
     * below.
     */
    private String loadPattern(String service) {
        double[] values = buffer.window(service, properties.getScaling().getLoadMetric(), LOAD_WINDOW).values();
        if (values.length < 2) {
            return IncidentContext.LOAD_NORMAL;
        }
        double mean = Arrays.stream(values, 0, values.length - 1).average().orElse(0.0);
        double latest = values[values.length - 1];
        if (mean <= 0) {
            return IncidentContext.LOAD_NORMAL;
        }
        if (latest > mean * SPIKE_RATIO) {
            return IncidentContext.LOAD_SPIKE;
        }
        if (latest < mean * DECLINE_RATIO) {
            return IncidentContext.LOAD_DECLINING;
        }
        return IncidentContext.LOAD_NORMAL;
    }
}
