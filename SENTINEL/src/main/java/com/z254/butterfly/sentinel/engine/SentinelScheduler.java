package com.z254.butterfly.sentinel.engine;

import com.z254.butterfly.sentinel.observability.SentinelStructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the engine loops on fixed delays. A failing pass is logged and the loop carries on
 * with the next one.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.loops", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SentinelScheduler {

    private final SentinelEngine engine;
    private final SentinelStructuredLogger structuredLogger;

    public SentinelScheduler(SentinelEngine engine, SentinelStructuredLogger structuredLogger) {
        this.engine = engine;
        this.structuredLogger = structuredLogger;
    }

    @Scheduled(fixedDelayString = "${sentinel.loops.detection:PT1S}")
    public void detectionLoop() {
        run("detection", () -> {
            DetectionCycleResult result = engine.runDetectionCycle();
            if (!result.alerts().isEmpty()) {
                log.info("Detection pass: {} series, {} alerts, {} incidents",
                        result.seriesExamined(), result.alerts().size(), result.incidents().size());
            }
        });
    }

    @Scheduled(fixedDelayString = "${sentinel.loops.forecast:PT30S}", initialDelayString = "${sentinel.loops.forecast:PT30S}")
    public void forecastLoop() {
        run("forecast", engine::runForecastCycle);
    }

    @Scheduled(fixedDelayString = "${sentinel.loops.health:PT30S}")
    public void healthLoop() {
        run("health", engine::runHealthCycle);
    }

    @Scheduled(fixedDelayString = "${sentinel.loops.scaling:PT60S}", initialDelayString = "${sentinel.loops.scaling:PT60S}")
    public void scalingLoop() {
        run("scaling", engine::runScalingCycle);
    }

    @Scheduled(fixedDelayString = "${sentinel.loops.alert-maintenance:PT10S}")
    public void alertMaintenanceLoop() {
        run("alert-maintenance", engine::runAlertMaintenance);
    }

    private void run(String loop, Runnable pass) {
        try (var scope = structuredLogger.withLoop(loop)) {
            pass.run();
        } catch (RuntimeException e) {
            log.error("{} loop pass failed: {}", loop, e.getMessage(), e);
        }
    }
}
