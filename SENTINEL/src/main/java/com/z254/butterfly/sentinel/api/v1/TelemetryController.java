package com.z254.butterfly.sentinel.api.v1;

import com.z254.butterfly.sentinel.api.dto.DeploymentRequest;
import com.z254.butterfly.sentinel.api.dto.IngestResponse;
import com.z254.butterfly.sentinel.api.dto.TelemetryBatchRequest;
import com.z254.butterfly.sentinel.api.dto.TelemetryRequest;
import com.z254.butterfly.sentinel.engine.SentinelEngine;
import com.z254.butterfly.sentinel.engine.SystemStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Telemetry and deployment intake.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Telemetry", description = "Telemetry and deployment intake")
public class TelemetryController {

    private final SentinelEngine engine;

    public TelemetryController(SentinelEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/telemetry")
    @Operation(summary = "Ingest sample", description = "Queue one telemetry sample for processing")
    public Mono<ResponseEntity<IngestResponse>> ingest(@Valid @RequestBody TelemetryRequest request) {
        return Mono.fromCallable(() -> {
            submit(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(acknowledge(1));
        });
    }

    @PostMapping("/telemetry/batch")
    @Operation(summary = "Ingest batch", description = "Queue a batch of telemetry samples for processing")
    public Mono<ResponseEntity<IngestResponse>> ingestBatch(@Valid @RequestBody TelemetryBatchRequest request) {
        return Mono.fromCallable(() -> {
            request.getSamples().forEach(this::submit);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(acknowledge(request.getSamples().size()));
        });
    }

    @PostMapping("/deployments")
    @Operation(summary = "Record deployment", description = "Record a service deployment used as incident context")
    public Mono<ResponseEntity<Void>> recordDeployment(@Valid @RequestBody DeploymentRequest request) {
        return Mono.fromRunnable(() -> engine.recordDeployment(
                        request.getServiceName(), request.getVersion(), request.getDeployedAt()))
                .thenReturn(ResponseEntity.accepted().build());
    }

    private void submit(TelemetryRequest request) {
        engine.ingest(request.getServiceName(), request.getMetricName(), request.getValue(), request.getTimestamp());
    }

    private IngestResponse acknowledge(int accepted) {
        SystemStats stats = engine.getSystemStats();
        return IngestResponse.builder()
                .accepted(accepted)
                .queueDepth(stats.ingestionQueueDepth())
                .droppedSamples(stats.samplesDropped())
                .build();
    }
}
