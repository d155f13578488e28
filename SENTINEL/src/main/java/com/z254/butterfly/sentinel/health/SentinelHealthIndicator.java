package com.z254.butterfly.sentinel.health;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.service.IncidentService;
import com.z254.butterfly.sentinel.telemetry.IngestionPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Health indicator for SENTINEL service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Ingestion consumer state and queue pressure</li>
 *     <li>Active incidents and resolution workflows</li>
 *     <li>Remediation capacity against the concurrency cap</li>
 * </ul>
 */
@Slf4j
@Component
public class SentinelHealthIndicator implements ReactiveHealthIndicator {

    private final IngestionPipeline ingestionPipeline;
    private final IncidentService incidentService;
    private final SentinelProperties sentinelProperties;

    private final AtomicInteger activeWorkflows = new AtomicInteger(0);

    public SentinelHealthIndicator(IngestionPipeline ingestionPipeline,
                                   IncidentService incidentService,
                                   SentinelProperties sentinelProperties) {
        this.ingestionPipeline = ingestionPipeline;
        this.incidentService = incidentService;
        this.sentinelProperties = sentinelProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        boolean consuming = ingestionPipeline.isRunning();
        details.put("ingestion.running", consuming);
        details.put("ingestion.queueDepth", ingestionPipeline.queueDepth());
        details.put("ingestion.queueCapacity", sentinelProperties.getIngestion().getQueueCapacity());
        details.put("ingestion.droppedSamples", ingestionPipeline.droppedSamples());
        if (!consuming) {
            healthy = false;
            details.put("ingestion.error", "Ingestion consumer not running");
        }

        details.put("activeIncidents", incidentService.activeCount());
        details.put("activeWorkflows", activeWorkflows.get());

        int maxResolutions = sentinelProperties.getResolution().getMaxConcurrentResolutions();
        details.put("remediationCapacity", canStartResolution() ? "AVAILABLE" : "AT_LIMIT");
        details.put("maxConcurrentResolutions", maxResolutions);

        details.put("autoResolutionEnabled", sentinelProperties.getResolution().isAutoResolutionEnabled());
        details.put("executorMode", sentinelProperties.getExecutor().getMode().name());

        if (healthy) {
            return Health.up()
                    .withDetails(details)
                    .build();
        } else {
            return Health.down()
                    .withDetails(details)
                    .build();
        }
    }

    public void incrementActiveWorkflows() {
        activeWorkflows.incrementAndGet();
    }

    public void decrementActiveWorkflows() {
        activeWorkflows.decrementAndGet();
    }

    public int activeWorkflows() {
        return activeWorkflows.get();
    }

    public boolean canStartResolution() {
        return activeWorkflows.get() < sentinelProperties.getResolution().getMaxConcurrentResolutions();
    }
}
