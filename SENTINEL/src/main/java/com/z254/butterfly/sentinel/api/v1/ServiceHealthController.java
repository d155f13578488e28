package com.z254.butterfly.sentinel.api.v1;

import com.z254.butterfly.sentinel.engine.SentinelEngine;
import com.z254.butterfly.sentinel.engine.SystemStats;
import com.z254.butterfly.sentinel.forecast.CapacityForecast;
import com.z254.butterfly.sentinel.health.ServiceHealthScore;
import com.z254.butterfly.sentinel.scaling.ScalingState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Per-service health, capacity forecasts and scaling status, plus engine statistics.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Services", description = "Service health, forecasts and scaling")
public class ServiceHealthController {

    private final SentinelEngine engine;

    public ServiceHealthController(SentinelEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/services/{service}/health")
    @Operation(summary = "Get service health", description = "Weighted health score of a service")
    public Mono<ResponseEntity<ServiceHealthScore>> getHealth(
            @Parameter(description = "Service name") @PathVariable String service) {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.getServiceHealth(service)));
    }

    @GetMapping("/forecasts/{service}/{metric}")
    @Operation(summary = "Get capacity forecast", description = "Latest capacity forecast of a series")
    public Mono<ResponseEntity<CapacityForecast>> getForecast(
            @Parameter(description = "Service name") @PathVariable String service,
            @Parameter(description = "Metric name") @PathVariable String metric) {
        return Mono.justOrEmpty(engine.getCapacityForecast(service, metric))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/scaling/{service}")
    @Operation(summary = "Get scaling status", description = "Instances, cooldown and last decision of a service")
    public Mono<ResponseEntity<ScalingState>> getScaling(
            @Parameter(description = "Service name") @PathVariable String service) {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.getScalingStatus(service)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get system statistics", description = "Counters across every engine component")
    public Mono<ResponseEntity<SystemStats>> getStats() {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.getSystemStats()));
    }
}
