package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.classification.ActionRecommender;
import com.z254.butterfly.sentinel.classification.KnowledgeBase;
import com.z254.butterfly.sentinel.classification.ResolutionPlan;
import com.z254.butterfly.sentinel.common.ErrorKind;
import com.z254.butterfly.sentinel.config.SentinelConfig;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentStatus;
import com.z254.butterfly.sentinel.domain.service.IncidentService;
import com.z254.butterfly.sentinel.health.SentinelHealthIndicator;
import com.z254.butterfly.sentinel.notification.NotificationRouter;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.ResolutionEventType;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs resolution workflows.
 * <p>
 * Drives an incident through {@code Classifying -> Resolving -> Resolved | Failed}, or
 * straight to {@code Escalated} when automation is not trusted:
 * <ol>
 *     <li>Confidence gate against the plan's success probability</li>
 *     <li>Planned actions one at a time, retried once on ordinary failure</li>
 *     <li>Verification from fresh telemetry after each successful action</li>
 *     <li>Reverse rollback on a critical failure or timeout</li>
 *     <li>Escalation of unresolved critical incidents</li>
 * </ol>
 * At most one workflow runs per incident; the worker pool bounds how many run at once.
 */
@Slf4j
@Service
public class ResolutionExecutor {

    private final SentinelProperties.Resolution config;
    private final ActionExecutor actionExecutor;
    private final IncidentService incidentService;
    private final ResolutionVerifier verifier;
    private final NotificationRouter notificationRouter;
    private final ActionRecommender recommender;
    private final KnowledgeBase knowledgeBase;
    private final SentinelHealthIndicator healthIndicator;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;
    private final Executor workers;

    // incidentId -> workflowId of the running workflow
    private final Map<String, String> activeWorkflows = new ConcurrentHashMap<>();

    public ResolutionExecutor(SentinelProperties properties,
                              ActionExecutor actionExecutor,
                              IncidentService incidentService,
                              ResolutionVerifier verifier,
                              NotificationRouter notificationRouter,
                              ActionRecommender recommender,
                              KnowledgeBase knowledgeBase,
                              SentinelHealthIndicator healthIndicator,
                              SentinelMetrics metrics,
                              SentinelStructuredLogger structuredLogger,
                              Clock clock,
                              @Qualifier(SentinelConfig.RESOLUTION_EXECUTOR) Executor workers) {
        this.config = properties.getResolution();
        this.actionExecutor = actionExecutor;
        this.incidentService = incidentService;
        this.verifier = verifier;
        this.notificationRouter = notificationRouter;
        this.recommender = recommender;
        this.knowledgeBase = knowledgeBase;
        this.healthIndicator = healthIndicator;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.workers = workers;
    }

    /**
     * Run the workflow for an incident on the worker pool.
     *
     * @throws WorkflowAlreadyActiveException if the incident already has a running workflow
     */
    public CompletableFuture<ResolutionResult> submit(Incident incident, ResolutionPlan plan) {
        String workflowId = acquire(incident.getId());
        try {
            return CompletableFuture.supplyAsync(() -> runAndRelease(workflowId, incident, plan), workers);
        } catch (RejectedExecutionException e) {
            activeWorkflows.remove(incident.getId(), workflowId);
            log.error("Resolution pool rejected incident {}: {}", incident.getId(), e.getMessage());
            return CompletableFuture.completedFuture(
                    escalate(workflowId, incident, plan, "Resolution capacity exhausted"));
        }
    }

    /**
     * Run the workflow for an incident on the calling thread.
     *
     * @throws WorkflowAlreadyActiveException if the incident already has a running workflow
     */
    public ResolutionResult resolve(Incident incident, ResolutionPlan plan) {
        return runAndRelease(acquire(incident.getId()), incident, plan);
    }

    public boolean isActive(String incidentId) {
        return activeWorkflows.containsKey(incidentId);
    }

    public int activeWorkflowCount() {
        return activeWorkflows.size();
    }

    // ========== Workflow ==========

    private String acquire(String incidentId) {
        String workflowId = "wf_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        String existing = activeWorkflows.putIfAbsent(incidentId, workflowId);
        if (existing != null) {
            throw new WorkflowAlreadyActiveException(incidentId, existing);
        }
        return workflowId;
    }

    private ResolutionResult runAndRelease(String workflowId, Incident incident, ResolutionPlan plan) {
        try {
            return run(workflowId, incident, plan);
        } finally {
            activeWorkflows.remove(incident.getId(), workflowId);
        }
    }

    private ResolutionResult run(String workflowId, Incident incident, ResolutionPlan plan) {
        if (incident.getStatus() == IncidentStatus.DETECTED) {
            incidentService.transition(incident.getId(), IncidentStatus.CLASSIFYING, "Classification started");
        }

        Optional<String> blocked = gate(incident, plan);
        if (blocked.isPresent()) {
            return escalate(workflowId, incident, plan, blocked.get());
        }

        ResolutionWorkflow workflow = ResolutionWorkflow.builder()
                .id(workflowId)
                .incidentId(incident.getId())
                .serviceName(incident.getServiceName())
                .actions(new ArrayList<>(plan.actions()))
                .successProbability(plan.successProbability())
                .rollbackActions(new ArrayList<>(plan.rollbackActions()))
                .startedAt(clock.instant())
                .build();

        Timer.Sample timer = metrics.startWorkflowTimer();
        healthIndicator.incrementActiveWorkflows();
        try {
            incidentService.transition(incident.getId(), IncidentStatus.RESOLVING,
                    String.format("Executing %d planned actions (p=%.2f)", plan.actions().size(), plan.successProbability()));
            workflow.log(transitionEntry(IncidentStatus.RESOLVING, "Resolution started"));
            structuredLogger.logResolutionEvent(workflowId, incident.getId(), ResolutionEventType.STARTED,
                    "Resolution workflow started", Map.of(
                            "service", incident.getServiceName(),
                            "actions", plan.actions().toString(),
                            "successProbability", String.format("%.2f", plan.successProbability())));

            Outcome outcome = executeActions(workflow, incident);
            return finish(workflow, incident, outcome, timer);
        } catch (RuntimeException e) {
            log.error("Resolution workflow {} for incident {} aborted", workflowId, incident.getId(), e);
            Outcome aborted = new Outcome(IncidentStatus.FAILED, "Workflow aborted: " + e.getMessage());
            return finish(workflow, incident, aborted, timer);
        } finally {
            healthIndicator.decrementActiveWorkflows();
        }
    }

    private Optional<String> gate(Incident incident, ResolutionPlan plan) {
        if (!config.isAutoResolutionEnabled()) {
            return Optional.of("Auto-resolution disabled");
        }
        if (plan.isEmpty()) {
            return Optional.of("No resolution actions available for " + incident.getType().code());
        }
        if (plan.successProbability() < config.getConfidenceThreshold()) {
            return Optional.of(String.format("Resolution confidence %.2f below threshold %.2f",
                    plan.successProbability(), config.getConfidenceThreshold()));
        }
        return Optional.empty();
    }

    private Outcome executeActions(ResolutionWorkflow workflow, Incident incident) {
        List<ActionType> actions = workflow.getActions();
        for (int i = 0; i < actions.size(); i++) {
            ActionType action = actions.get(i);
            workflow.setCurrentStep(i);

            Map<String, Double> before = verifier.capture(incident.getServiceName());
            Attempt attempt = executeWithRetry(workflow, action);
            ActionResult result = attempt.result();

            boolean resolved = false;
            if (result.isSuccess()) {
                settle();
                Map<String, Double> after = verifier.capture(incident.getServiceName());
                resolved = verifier.isResolved(incident, after);
                recordAction(workflow, action, attempt, before, after);
                workflow.log(ExecutionLogEntry.builder()
                        .kind(ExecutionLogEntry.EntryKind.VERIFICATION)
                        .action(action.code())
                        .timestamp(clock.instant())
                        .success(resolved)
                        .details(resolved ? "Incident resolved" : "Incident still active")
                        .metricsAfter(after)
                        .build());
                recommender.recordOutcome(incident.getType(), action, resolved);
                if (resolved) {
                    knowledgeBase.learn(incident.getType(), action);
                    structuredLogger.logResolutionEvent(workflow.getId(), incident.getId(),
                            ResolutionEventType.VERIFIED, "Resolution verified after " + action.code(),
                            Map.of("action", action.code(), "step", i));
                    return new Outcome(IncidentStatus.RESOLVED, "Resolved by " + action.code());
                }
                log.info("Incident {} still active after action {}", incident.getId(), action.code());
                continue;
            }

            recordAction(workflow, action, attempt, before, verifier.capture(incident.getServiceName()));
            recommender.recordOutcome(incident.getType(), action, false);

            if (result.isCriticalFailure()) {
                rollback(workflow, incident, i);
                return new Outcome(IncidentStatus.FAILED,
                        "Critical failure in " + action.code() + ": " + result.getErrorMessage());
            }
            if (i < actions.size() - 1) {
                settle();
            }
        }
        return new Outcome(IncidentStatus.FAILED, "All planned actions exhausted without verified resolution");
    }

    private Attempt executeWithRetry(ResolutionWorkflow workflow, ActionType action) {
        int maxAttempts = 1 + Math.max(0, config.getMaxActionRetries());
        ActionResult result = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            result = invoke(workflow, action.code(), action, false, attempt);
            if (result.isSuccess() || result.isCriticalFailure()) {
                break;
            }
            if (attempt < maxAttempts) {
                log.info("Retrying {} for incident {} after failure: {}",
                        action.code(), workflow.getIncidentId(), result.getErrorMessage());
            }
        }
        return new Attempt(result, attempt);
    }

    /**
     * Call the executor with the action timeout. Timeouts and critical exceptions come back
     * as critical failures.
     */
    private ActionResult invoke(ResolutionWorkflow workflow, String actionName, ActionType actionType,
                                boolean rollback, int attempt) {
        ActionRequest request = ActionRequest.builder()
                .requestId(workflow.getId() + "-" + workflow.getCurrentStep() + (rollback ? "-rb" : "") + "-" + attempt)
                .workflowId(workflow.getId())
                .incidentId(workflow.getIncidentId())
                .serviceName(workflow.getServiceName())
                .actionType(actionType)
                .action(actionName)
                .rollback(rollback)
                .attempt(attempt)
                .timeout(config.getActionTimeout())
                .build();
        try {
            ActionResult result = actionExecutor.execute(request)
                    .timeout(config.getActionTimeout())
                    .block();
            return result != null ? result
                    : ActionResult.failed("Executor returned no result", false, clock.instant());
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                structuredLogger.logResolutionEvent(workflow.getId(), workflow.getIncidentId(),
                        ResolutionEventType.ACTION_TIMED_OUT, "Action timed out", Map.of(
                                "action", actionName,
                                "timeout", config.getActionTimeout().toString()));
                return ActionResult.failed("Timed out after " + config.getActionTimeout(), true, clock.instant());
            }
            if (cause instanceof ActionExecutionException executionError) {
                return ActionResult.failed(executionError.getMessage(), executionError.isCritical(), clock.instant());
            }
            log.error("Action {} for incident {} raised {}", actionName, workflow.getIncidentId(), cause.toString());
            return ActionResult.failed(String.valueOf(cause.getMessage()), false, clock.instant());
        }
    }

    /**
     * Compensate steps {@code 0..failedStep} in reverse order.
     */
    private void rollback(ResolutionWorkflow workflow, Incident incident, int failedStep) {
        for (int step = failedStep; step >= 0; step--) {
            String rollbackAction = workflow.getRollbackActions().get(step);
            workflow.setCurrentStep(step);
            ActionResult result = invoke(workflow, rollbackAction, null, true, 1);
            Instant at = clock.instant();

            workflow.log(ExecutionLogEntry.builder()
                    .kind(ExecutionLogEntry.EntryKind.ROLLBACK)
                    .action(rollbackAction)
                    .timestamp(at)
                    .success(result.isSuccess())
                    .attempt(1)
                    .details(result.isSuccess() ? result.getMessage() : result.getErrorMessage())
                    .build());
            incidentService.recordRollback(incident.getId(), Incident.ResolutionRecord.builder()
                    .workflowId(workflow.getId())
                    .action(rollbackAction)
                    .timestamp(at)
                    .success(result.isSuccess())
                    .message(result.isSuccess() ? result.getMessage() : result.getErrorMessage())
                    .build());
            metrics.recordActionRolledBack();
            structuredLogger.logResolutionEvent(workflow.getId(), incident.getId(),
                    result.isSuccess() ? ResolutionEventType.ROLLED_BACK : ResolutionEventType.ROLLBACK_FAILED,
                    "Rollback " + rollbackAction + (result.isSuccess() ? " completed" : " failed"),
                    Map.of("action", rollbackAction, "step", step));
        }
    }

    private ResolutionResult finish(ResolutionWorkflow workflow, Incident incident, Outcome outcome,
                                    Timer.Sample timer) {
        workflow.setCompletedAt(clock.instant());
        workflow.log(transitionEntry(outcome.status(), outcome.description()));

        Optional<Incident> current = incidentService.getIncident(incident.getId());
        if (current.isPresent() && current.get().isActive()) {
            incidentService.transition(incident.getId(), outcome.status(), outcome.description());
        }

        boolean success = outcome.status() == IncidentStatus.RESOLVED;
        String escalationReason = null;
        if (!success && current.map(Incident::requiresEscalationWhenUnresolved).orElse(false)) {
            escalationReason = "Automated resolution failed for " + incident.getSeverity()
                    + " incident: " + outcome.description();
            incidentService.annotateEscalation(incident.getId(), escalationReason);
            notificationRouter.notifyEscalation(current.get(), escalationReason);
        }

        List<String> executed = workflow.entries(ExecutionLogEntry.EntryKind.ACTION).stream()
                .map(ExecutionLogEntry::getAction)
                .toList();
        Duration elapsed = Duration.between(workflow.getStartedAt(), workflow.getCompletedAt());

        metrics.recordWorkflowFinished(timer, outcome.status().name());
        structuredLogger.logResolutionEvent(workflow.getId(), incident.getId(),
                success ? ResolutionEventType.COMPLETED : ResolutionEventType.FAILED,
                "Resolution workflow finished: " + outcome.description(), Map.of(
                        "status", outcome.status().name(),
                        "actionsExecuted", executed.size(),
                        "durationMs", elapsed.toMillis()));

        return ResolutionResult.builder()
                .workflowId(workflow.getId())
                .incidentId(incident.getId())
                .success(success)
                .finalStatus(outcome.status())
                .actionsExecuted(new ArrayList<>(executed))
                .resolutionTime(elapsed)
                .confidence(workflow.getSuccessProbability())
                .impactAssessment(ImpactAssessment.of(workflow))
                .lessonsLearned(lessonsLearned(workflow))
                .requiresHumanReview(!success || executed.size() > 2)
                .escalationReason(escalationReason)
                .build();
    }

    private ResolutionResult escalate(String workflowId, Incident incident, ResolutionPlan plan, String reason) {
        log.info("Escalating incident {} without automated resolution: {}", incident.getId(), reason);
        Optional<Incident> escalated = incidentService.escalate(incident.getId(), reason);
        escalated.ifPresent(current -> notificationRouter.notifyEscalation(current, reason));
        structuredLogger.logResolutionEvent(workflowId, incident.getId(), ResolutionEventType.ESCALATED,
                "Escalation required", Map.of(
                        "reason", reason,
                        "kind", ErrorKind.ESCALATION_REQUIRED.name(),
                        "successProbability", String.format("%.2f", plan.successProbability())));

        return ResolutionResult.builder()
                .workflowId(workflowId)
                .incidentId(incident.getId())
                .success(false)
                .finalStatus(IncidentStatus.ESCALATED)
                .resolutionTime(Duration.ZERO)
                .confidence(plan.successProbability())
                .requiresHumanReview(true)
                .escalationReason(reason)
                .build();
    }

    // ========== Helpers ==========

    private void recordAction(ResolutionWorkflow workflow, ActionType action, Attempt attempt,
                              Map<String, Double> before, Map<String, Double> after) {
        ActionResult result = attempt.result();
        Instant at = result.getExecutedAt() != null ? result.getExecutedAt() : clock.instant();
        String message = result.isSuccess() ? result.getMessage() : result.getErrorMessage();

        workflow.log(ExecutionLogEntry.builder()
                .kind(ExecutionLogEntry.EntryKind.ACTION)
                .action(action.code())
                .timestamp(at)
                .success(result.isSuccess())
                .attempt(attempt.attempts())
                .details(message)
                .metricsBefore(before)
                .metricsAfter(after)
                .build());
        incidentService.recordAttempt(workflow.getIncidentId(), action, Incident.ResolutionRecord.builder()
                .workflowId(workflow.getId())
                .action(action.code())
                .timestamp(at)
                .success(result.isSuccess())
                .message(message)
                .metricsBefore(before)
                .metricsAfter(after)
                .build());
        metrics.recordActionExecuted(action.code(), result.isSuccess());
        structuredLogger.logResolutionEvent(workflow.getId(), workflow.getIncidentId(),
                result.isSuccess() ? ResolutionEventType.ACTION_SUCCEEDED : ResolutionEventType.ACTION_FAILED,
                "Action " + action.code() + (result.isSuccess() ? " succeeded" : " failed"), Map.of(
                        "action", action.code(),
                        "attempts", attempt.attempts(),
                        "critical", result.isCriticalFailure(),
                        "message", message != null ? message : ""));
    }

    private ExecutionLogEntry transitionEntry(IncidentStatus status, String description) {
        return ExecutionLogEntry.builder()
                .kind(ExecutionLogEntry.EntryKind.TRANSITION)
                .action(status.name())
                .timestamp(clock.instant())
                .success(status != IncidentStatus.FAILED)
                .details(description)
                .build();
    }

    private void settle() {
        Duration delay = config.getSettleDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the system to settle", e);
        }
    }

    static List<String> lessonsLearned(ResolutionWorkflow workflow) {
        List<String> lessons = new ArrayList<>();
        List<ExecutionLogEntry> attempts = workflow.entries(ExecutionLogEntry.EntryKind.ACTION);
        List<ExecutionLogEntry> succeeded = attempts.stream().filter(ExecutionLogEntry::isSuccess).toList();
        List<String> failed = attempts.stream()
                .filter(entry -> !entry.isSuccess())
                .map(ExecutionLogEntry::getAction)
                .toList();

        if (!succeeded.isEmpty()) {
            lessons.add("Most effective action: " + succeeded.get(0).getAction());
        }
        if (!failed.isEmpty()) {
            lessons.add("Failed actions need investigation: " + failed);
        }
        if (workflow.getStartedAt() != null && workflow.getCompletedAt() != null) {
            long seconds = Duration.between(workflow.getStartedAt(), workflow.getCompletedAt()).toSeconds();
            if (seconds < 60) {
                lessons.add("Resolution was completed quickly - good automation");
            } else if (seconds > 300) {
                lessons.add("Resolution took longer than expected - review workflow");
            }
        }
        if (workflow.getActions().size() == 1 && succeeded.size() == 1) {
            lessons.add("Single action resolution - excellent targeting");
        } else if (succeeded.size() < workflow.getActions().size() / 2.0) {
            lessons.add("Low success rate - review action selection logic");
        }
        return lessons;
    }

    private record Attempt(ActionResult result, int attempts) {
    }

    private record Outcome(IncidentStatus status, String description) {
    }
}
