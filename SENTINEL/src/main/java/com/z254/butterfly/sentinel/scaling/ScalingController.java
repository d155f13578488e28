package com.z254.butterfly.sentinel.scaling;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.forecast.CapacityForecast;
import com.z254.butterfly.sentinel.forecast.ForecastStore;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger.ScalingEventType;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Predictive scaling loop.
 * <p>
 * The scaling factor is the largest of the forecast load ratio and the CPU and memory
 * utilisation ratios against target. Decisions are discarded below the confidence floor,
 * suppressed during a service's cooldown and never emitted for {@code MAINTAIN}. Each
 * service is evaluated under its own lock so unrelated services never wait on each other.
 */
@Slf4j
@Component
public class ScalingController {

    static final Map<String, Double> ROLLBACK_CRITERIA = Map.of(
            "max_response_time_ms", 200.0,
            "max_error_rate", 0.05,
            "min_cpu_utilization", 0.1);

    private final SentinelProperties.Scaling config;
    private final TelemetryBuffer buffer;
    private final ForecastStore forecastStore;
    private final ScalingExecutor scalingExecutor;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    private final Map<String, ServiceScaling> services = new ConcurrentHashMap<>();
    private final Deque<ScalingDecision> history = new ArrayDeque<>();

    public ScalingController(SentinelProperties properties,
                             TelemetryBuffer buffer,
                             ForecastStore forecastStore,
                             ScalingExecutor scalingExecutor,
                             SentinelMetrics metrics,
                             SentinelStructuredLogger structuredLogger,
                             Clock clock) {
        this.config = properties.getScaling();
        this.buffer = buffer;
        this.forecastStore = forecastStore;
        this.scalingExecutor = scalingExecutor;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Evaluate every service with telemetry. Returns the decisions that were executed.
     */
    public List<ScalingDecision> evaluateAll() {
        List<ScalingDecision> executed = new ArrayList<>();
        for (String service : buffer.services()) {
            try {
                evaluate(service).ifPresent(executed::add);
            } catch (RuntimeException e) {
                log.error("Scaling evaluation failed for {}: {}", service, e.getMessage(), e);
            }
        }
        return executed;
    }

    /**
     * Evaluate one service and execute the decision when it passes cooldown and confidence.
     */
    public Optional<ScalingDecision> evaluate(String service) {
        ServiceScaling state = stateFor(service);
        if (!state.configuration.autoScalingEnabled()) {
            return Optional.empty();
        }

        state.lock.lock();
        try {
            Instant now = clock.instant();
            Duration remaining = cooldownRemaining(state, now);
            if (!remaining.isZero()) {
                metrics.recordScalingSuppressed("cooldown");
                structuredLogger.logScalingEvent(service, ScalingEventType.COOLDOWN,
                        "Scaling suppressed during cooldown", Map.of("remaining", remaining.toString()));
                return Optional.empty();
            }

            Optional<ScalingDecision> candidate = decide(state, now);
            if (candidate.isEmpty()) {
                return Optional.empty();
            }
            ScalingDecision decision = candidate.get();
            if (decision.getConfidence() < config.getConfidenceFloor()) {
                metrics.recordScalingSuppressed("low_confidence");
                structuredLogger.logScalingEvent(service, ScalingEventType.LOW_CONFIDENCE,
                        "Scaling decision discarded", Map.of(
                                "confidence", String.format("%.2f", decision.getConfidence()),
                                "floor", config.getConfidenceFloor()));
                return Optional.empty();
            }

            execute(state, decision, now);
            return Optional.of(decision);
        } finally {
            state.lock.unlock();
        }
    }

    public ScalingState getScalingStatus(String service) {
        ServiceScaling state = stateFor(service);
        state.lock.lock();
        try {
            IncidentMetrics current = IncidentMetrics.fromLatest(buffer.latestValues(service), clock.instant());
            return new ScalingState(state.configuration, state.currentInstances, state.lastDecision,
                    state.lastExecutedAt, cooldownRemaining(state, clock.instant()),
                    current.getCpuUsage(), current.getMemoryUsage());
        } finally {
            state.lock.unlock();
        }
    }

    public List<ScalingDecision> getHistory(String service) {
        synchronized (history) {
            return history.stream()
                    .filter(decision -> service == null || service.equals(decision.getServiceName()))
                    .toList();
        }
    }

    public ResourceConfiguration configurationFor(String service) {
        return stateFor(service).configuration;
    }

    // ========== Decision ==========

    /**
     * Candidate decision from current utilisation and the load forecast. Empty for
     * {@code MAINTAIN} or when the service reports nothing to scale on.
     */
    private Optional<ScalingDecision> decide(ServiceScaling state, Instant now) {
        ResourceConfiguration configuration = state.configuration;
        String service = configuration.serviceName();
        IncidentMetrics current = IncidentMetrics.fromLatest(buffer.latestValues(service), now);
        OptionalDouble currentLoad = buffer.latest(service, config.getLoadMetric());
        Optional<CapacityForecast> loadForecast = forecastStore.get(service, config.getLoadMetric());

        Double cpu = fraction(current.getCpuUsage());
        Double memory = fraction(current.getMemoryUsage());
        if (cpu == null && memory == null && loadForecast.isEmpty()) {
            return Optional.empty();
        }

        double factor = 0.0;
        double predictedLoad = currentLoad.orElse(0.0);
        double confidence = config.getUtilizationConfidence();
        ScalingTrigger trigger = ScalingTrigger.CURRENT_UTILIZATION;

        if (loadForecast.isPresent()) {
            predictedLoad = loadForecast.get().maxForecastValue();
            double baseLoad = currentLoad.orElse(loadForecast.get().getCurrentValue());
            // A zero base carries no ratio; utilisation alone decides then
            factor = baseLoad > 0 ? predictedLoad / baseLoad : 0.0;
            confidence = loadForecast.get().getConfidence();
            trigger = ScalingTrigger.PREDICTED_LOAD;
        }
        if (cpu != null) {
            factor = Math.max(factor, cpu / configuration.targetCpu());
        }
        if (memory != null) {
            factor = Math.max(factor, memory / configuration.targetMemory());
        }

        int currentInstances = state.currentInstances;
        int target = configuration.clamp((int) Math.ceil(currentInstances * factor));
        ScalingDirection direction = target > currentInstances ? ScalingDirection.UP
                : target < currentInstances ? ScalingDirection.DOWN
                : ScalingDirection.MAINTAIN;
        if (direction == ScalingDirection.MAINTAIN) {
            return Optional.empty();
        }
        if (direction == ScalingDirection.DOWN) {
            trigger = ScalingTrigger.COST_OPTIMIZATION;
        }

        return Optional.of(ScalingDecision.builder()
                .id("scale_" + service + "_" + now.toEpochMilli())
                .serviceName(service)
                .currentInstances(currentInstances)
                .targetInstances(target)
                .direction(direction)
                .predictedLoad(predictedLoad)
                .confidence(confidence)
                .costImpact((target - currentInstances) * configuration.costPerHour())
                .performanceImpact(direction == ScalingDirection.UP ? 0.2 : -0.1)
                .trigger(trigger)
                .decidedAt(now)
                .executeAt(now.plus(config.getExecutionDelay()))
                .rollbackCriteria(new LinkedHashMap<>(ROLLBACK_CRITERIA))
                .build());
    }

    private void execute(ServiceScaling state, ScalingDecision decision, Instant now) {
        String service = decision.getServiceName();
        structuredLogger.logScalingEvent(service, ScalingEventType.DECIDED,
                "Scaling " + decision.getDirection() + " " + decision.getCurrentInstances()
                        + " -> " + decision.getTargetInstances(), Map.of(
                        "trigger", decision.getTrigger().name(),
                        "predictedLoad", String.format("%.2f", decision.getPredictedLoad()),
                        "confidence", String.format("%.2f", decision.getConfidence()),
                        "costImpact", String.format("%.2f", decision.getCostImpact())));

        boolean success;
        try {
            success = Boolean.TRUE.equals(scalingExecutor.scale(decision).block());
        } catch (RuntimeException e) {
            log.error("Scaling executor failed for {}: {}", service, e.getMessage());
            success = false;
        }

        decision.setExecuted(true);
        decision.setExecutionSucceeded(success);
        state.lastExecutedAt = now;
        state.lastDecision = decision;
        if (success) {
            state.currentInstances = decision.getTargetInstances();
        }
        metrics.recordScalingDecision(decision.getDirection().name());
        structuredLogger.logScalingEvent(service,
                success ? ScalingEventType.EXECUTED : ScalingEventType.EXECUTION_FAILED,
                success ? "Scaling executed" : "Scaling execution failed",
                Map.of("targetInstances", decision.getTargetInstances()));

        synchronized (history) {
            history.addLast(decision);
            while (history.size() > config.getHistorySize()) {
                history.removeFirst();
            }
        }
    }

    /**
     * Utilisation as a fraction; absolute readings such as megabytes are ignored.
     */
    private static Double fraction(Double value) {
        return value != null && value >= 0.0 && value <= 1.0 ? value : null;
    }

    private Duration cooldownRemaining(ServiceScaling state, Instant now) {
        if (state.lastExecutedAt == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(state.lastExecutedAt, now);
        Duration remaining = config.getCooldown().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private ServiceScaling stateFor(String service) {
        return services.computeIfAbsent(service, name -> {
            SentinelProperties.Scaling.ResourceDefaults defaults =
                    config.getServices().getOrDefault(name, config.getDefaults());
            ResourceConfiguration configuration = ResourceConfiguration.from(name, defaults);
            return new ServiceScaling(configuration, configuration.clamp(configuration.initialInstances()));
        });
    }

    /**
     * Mutable per-service state, guarded by its lock.
     */
    private static final class ServiceScaling {
        private final ReentrantLock lock = new ReentrantLock();
        private final ResourceConfiguration configuration;
        private int currentInstances;
        private Instant lastExecutedAt;
        private ScalingDecision lastDecision;

        ServiceScaling(ResourceConfiguration configuration, int currentInstances) {
            this.configuration = configuration;
            this.currentInstances = currentInstances;
        }
    }
}
