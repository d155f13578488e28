package com.z254.butterfly.sentinel.engine;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.AlertEngine;
import com.z254.butterfly.sentinel.alerting.CorrelationRecord;
import com.z254.butterfly.sentinel.classification.IncidentClassifier;
import com.z254.butterfly.sentinel.common.Result;
import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.detection.AnomalyResult;
import com.z254.butterfly.sentinel.detection.DetectionModelStore;
import com.z254.butterfly.sentinel.detection.Detector;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.service.DeploymentRegistry;
import com.z254.butterfly.sentinel.domain.service.IncidentService;
import com.z254.butterfly.sentinel.forecast.CapacityForecast;
import com.z254.butterfly.sentinel.forecast.CapacityForecaster;
import com.z254.butterfly.sentinel.forecast.Forecast;
import com.z254.butterfly.sentinel.forecast.ForecastStore;
import com.z254.butterfly.sentinel.forecast.Forecaster;
import com.z254.butterfly.sentinel.health.HealthScorer;
import com.z254.butterfly.sentinel.health.ServiceHealthScore;
import com.z254.butterfly.sentinel.notification.NotificationRouter;
import com.z254.butterfly.sentinel.observability.SentinelMetrics;
import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import com.z254.butterfly.sentinel.resolution.ResolutionExecutor;
import com.z254.butterfly.sentinel.scaling.ScalingController;
import com.z254.butterfly.sentinel.scaling.ScalingDecision;
import com.z254.butterfly.sentinel.scaling.ScalingState;
import com.z254.butterfly.sentinel.telemetry.IngestionPipeline;
import com.z254.butterfly.sentinel.telemetry.MetricKey;
import com.z254.butterfly.sentinel.telemetry.MetricWindow;
import com.z254.butterfly.sentinel.telemetry.NewSamples;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The autonomic loop: telemetry in, alerts, incidents, resolutions and scaling out.
 * <p>
 * Constructed once and shared by every periodic loop. Each {@code run*} method is one pass
 * of one loop and is safe to call from its own thread; loops only meet in the telemetry
 * buffer, the incident service and the scaling controller.
 */
@Slf4j
@Component
public class SentinelEngine {

    private final SentinelProperties properties;
    private final IngestionPipeline ingestionPipeline;
    private final TelemetryBuffer buffer;
    private final Detector detector;
    private final DetectionModelStore modelStore;
    private final Forecaster forecaster;
    private final CapacityForecaster capacityForecaster;
    private final ForecastStore forecastStore;
    private final AlertEngine alertEngine;
    private final HealthScorer healthScorer;
    private final IncidentClassifier classifier;
    private final IncidentCoordinator coordinator;
    private final IncidentService incidentService;
    private final DeploymentRegistry deploymentRegistry;
    private final ResolutionExecutor resolutionExecutor;
    private final NotificationRouter notificationRouter;
    private final ScalingController scalingController;
    private final SentinelMetrics metrics;
    private final SentinelStructuredLogger structuredLogger;
    private final Clock clock;

    private final AtomicLong forecastCycles = new AtomicLong();

    public SentinelEngine(SentinelProperties properties,
                          IngestionPipeline ingestionPipeline,
                          TelemetryBuffer buffer,
                          Detector detector,
                          DetectionModelStore modelStore,
                          Forecaster forecaster,
                          CapacityForecaster capacityForecaster,
                          ForecastStore forecastStore,
                          AlertEngine alertEngine,
                          HealthScorer healthScorer,
                          IncidentClassifier classifier,
                          IncidentCoordinator coordinator,
                          IncidentService incidentService,
                          DeploymentRegistry deploymentRegistry,
                          ResolutionExecutor resolutionExecutor,
                          NotificationRouter notificationRouter,
                          ScalingController scalingController,
                          SentinelMetrics metrics,
                          SentinelStructuredLogger structuredLogger,
                          Clock clock) {
        this.properties = properties;
        this.ingestionPipeline = ingestionPipeline;
        this.buffer = buffer;
        this.detector = detector;
        this.modelStore = modelStore;
        this.forecaster = forecaster;
        this.capacityForecaster = capacityForecaster;
        this.forecastStore = forecastStore;
        this.alertEngine = alertEngine;
        this.healthScorer = healthScorer;
        this.classifier = classifier;
        this.coordinator = coordinator;
        this.incidentService = incidentService;
        this.deploymentRegistry = deploymentRegistry;
        this.resolutionExecutor = resolutionExecutor;
        this.notificationRouter = notificationRouter;
        this.scalingController = scalingController;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    // ========== Intake ==========

    /**
     * Queue one telemetry sample.
     *
     * @throws IllegalArgumentException when the sample is malformed
     */
    public void ingest(String service, String metric, double value, Instant timestamp) {
        ingestionPipeline.submit(service, metric, value, timestamp != null ? timestamp : clock.instant());
    }

    public void recordDeployment(String service, String version, Instant deployedAt) {
        deploymentRegistry.recordDeployment(service, version, deployedAt != null ? deployedAt : clock.instant());
    }

    // ========== Loops ==========

    /**
     * Judge every sample applied since the last pass against the window that ended at it,
     * oldest first, then dispatch the resulting alerts most severe first.
     */
    public DetectionCycleResult runDetectionCycle() {
        ingestionPipeline.drainPending();
        SentinelProperties.Detection config = properties.getDetection();
        List<NewSamples> fresh = ingestionPipeline.takeNewSamples(
                Math.max(config.getWindowSize(), properties.getForecast().getWindowSize()));
        if (fresh.isEmpty()) {
            return DetectionCycleResult.empty();
        }

        List<Alert> raised = new ArrayList<>();
        int examined = 0;
        for (NewSamples series : fresh) {
            if (series.history().size() < config.getMinSamples()) {
                continue;
            }
            examined++;
            try {
                raised.addAll(detect(series, config));
            } catch (RuntimeException e) {
                metrics.recordDetectionError();
                log.error("Detection failed for {}: {}", series.history().key(), e.getMessage(), e);
            }
        }
        return dispatch(examined, raised);
    }

    /**
     * Refresh capacity forecasts for every series, raise predictive alerts for limits reached
     * inside the horizon, and periodically retrain the models.
     */
    public DetectionCycleResult runForecastCycle() {
        long cycle = forecastCycles.incrementAndGet();
        List<Alert> raised = new ArrayList<>();
        int examined = 0;
        int windowSize = properties.getForecast().getWindowSize();

        for (MetricKey key : buffer.keys()) {
            examined++;
            try {
                MetricWindow window = buffer.window(key, windowSize);
                Timer.Sample sample = metrics.startForecastTimer();
                Result<CapacityForecast> result = capacityForecaster.forecast(window);
                if (!result.isOk()) {
                    metrics.recordForecastUnavailable(result.getErrorKind().name());
                    forecastStore.remove(key);
                    continue;
                }
                CapacityForecast forecast = result.getValue();
                metrics.recordForecastCompleted(sample, forecast.getMethod().name());
                forecastStore.put(forecast);
                if (forecast.isCapacityAtRisk()) {
                    alertEngine.evaluatePredictive(forecast, window,
                            healthScorer.overallScore(key.serviceName()).orElse(null)).ifPresent(raised::add);
                }
            } catch (RuntimeException e) {
                metrics.recordDetectionError();
                log.error("Forecast failed for {}: {}", key, e.getMessage(), e);
            }
        }

        if ((cycle - 1) % properties.getDetection().getEnsemble().getRetrainEveryCycles() == 0) {
            retrainModels();
        }
        return dispatch(examined, raised);
    }

    public List<ServiceHealthScore> runHealthCycle() {
        List<ServiceHealthScore> refreshed = new ArrayList<>();
        for (String service : buffer.services()) {
            try {
                refreshed.add(healthScorer.refresh(service));
            } catch (RuntimeException e) {
                log.error("Health scoring failed for {}: {}", service, e.getMessage(), e);
            }
        }
        return refreshed;
    }

    public List<ScalingDecision> runScalingCycle() {
        return scalingController.evaluateAll();
    }

    public int runAlertMaintenance() {
        return alertEngine.maintain();
    }

    /**
     * Retrain detection ensembles for series with enough history, and the incident classifier
     * from closed incidents.
     */
    public int retrainModels() {
        int trained = 0;
        int minSamples = properties.getDetection().getEnsemble().getMinTrainingSamples();
        for (MetricKey key : buffer.keys()) {
            if (buffer.size(key) < minSamples) {
                continue;
            }
            try {
                if (modelStore.train(buffer.window(key, buffer.capacity())).isPresent()) {
                    metrics.recordModelTrained();
                    trained++;
                }
            } catch (RuntimeException e) {
                log.error("Model training failed for {}: {}", key, e.getMessage(), e);
            }
        }
        if (classifier.train(incidentService.getClosedIncidents())) {
            trained++;
        }
        if (trained > 0) {
            log.info("Retrained {} models", trained);
        }
        return trained;
    }

    // ========== Queries ==========

    /**
     * Current health of a service. Repeated calls without new samples return the same score.
     */
    public ServiceHealthScore getServiceHealth(String service) {
        return healthScorer.refresh(service);
    }

    public List<Alert> getActiveAlerts(int limit) {
        return alertEngine.getActiveAlerts(limit);
    }

    public List<Incident> getActiveIncidents() {
        return incidentService.getActiveIncidents();
    }

    public Optional<CapacityForecast> getCapacityForecast(String service, String metric) {
        return forecastStore.get(service, metric);
    }

    /**
     * Point forecast of a series on demand.
     */
    public Result<Forecast> predict(String service, String metric) {
        return forecaster.predict(buffer.window(service, metric, properties.getForecast().getWindowSize()));
    }

    public ScalingState getScalingStatus(String service) {
        return scalingController.getScalingStatus(service);
    }

    public List<CorrelationRecord> getCorrelations() {
        return alertEngine.getCorrelations();
    }

    public SystemStats getSystemStats() {
        return new SystemStats(
                buffer.services().size(),
                buffer.keys().size(),
                buffer.totalSamples(),
                ingestionPipeline.droppedSamples(),
                ingestionPipeline.queueDepth(),
                alertEngine.bufferedAlerts(),
                incidentService.activeCount(),
                resolutionExecutor.activeWorkflowCount(),
                alertEngine.getCorrelations().size(),
                forecastStore.size(),
                modelStore.size(),
                classifier.isTrained(),
                clock.instant());
    }

    // ========== Private Methods ==========

    /**
     * Walk a series' new samples in arrival order, each against the window ending at it.
     */
    private List<Alert> detect(NewSamples series, SentinelProperties.Detection config) {
        MetricWindow history = series.history();
        List<Alert> alerts = new ArrayList<>();
        for (int end = Math.max(config.getMinSamples(), series.firstEnd()); end <= history.size(); end++) {
            detectAt(history, end, config).ifPresent(alerts::add);
        }
        return alerts;
    }

    private Optional<Alert> detectAt(MetricWindow history, int end, SentinelProperties.Detection config) {
        MetricWindow window = history.endingAt(end, config.getWindowSize());
        String service = window.serviceName();
        AnomalyResult result = detector.detect(window);
        if (result.hasData()) {
            healthScorer.recordAnomalyScore(service, result.score());
        }
        if (!result.anomaly()) {
            return Optional.empty();
        }
        metrics.recordAnomalyDetected(result.anomalyType().name());

        Optional<Forecast> forecast = Optional.empty();
        if (result.score() >= config.getAnomalyThreshold()) {
            forecast = forecaster.predict(history.endingAt(end, properties.getForecast().getWindowSize()))
                    .toOptional();
        }
        return alertEngine.evaluate(result, window, forecast, healthScorer.overallScore(service).orElse(null));
    }

    /**
     * Promote, correlate and notify, most severe alert first so it drives the incident.
     */
    private DetectionCycleResult dispatch(int examined, List<Alert> raised) {
        List<Alert> surfaced = AlertEngine.bySeverity(raised).stream()
                .filter(alert -> !alert.isSuppressed())
                .toList();
        Map<String, Incident> incidents = new LinkedHashMap<>();

        for (Alert alert : surfaced) {
            try (var scope = structuredLogger.withContext(Map.of(
                    SentinelStructuredLogger.MDC_SERVICE, alert.getServiceName(),
                    SentinelStructuredLogger.MDC_ALERT_ID, alert.getId()))) {
                coordinator.promote(alert).ifPresent(incident -> incidents.put(incident.getId(), incident));
                alertEngine.correlate(alert)
                        .flatMap(coordinator::promote)
                        .ifPresent(incident -> incidents.put(incident.getId(), incident));
                notificationRouter.notifyAlert(alert);
            } catch (RuntimeException e) {
                log.error("Dispatch failed for alert {}: {}", alert.getId(), e.getMessage(), e);
            }
        }
        return new DetectionCycleResult(examined, surfaced, new ArrayList<>(incidents.values()));
    }
}
