package com.z254.butterfly.sentinel.api.v1;

import com.z254.butterfly.sentinel.alerting.Alert;
import com.z254.butterfly.sentinel.alerting.CorrelationRecord;
import com.z254.butterfly.sentinel.engine.SentinelEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Alerts", description = "Active alerts and correlations")
public class AlertController {

    private final SentinelEngine engine;

    public AlertController(SentinelEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/alerts")
    @Operation(summary = "List active alerts", description = "Active alerts, most severe first")
    public Mono<ResponseEntity<List<Alert>>> getActiveAlerts(
            @Parameter(description = "Maximum number of alerts") @RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.getActiveAlerts(Math.max(limit, 0))));
    }

    @GetMapping("/correlations")
    @Operation(summary = "List correlations", description = "Correlation records grouping related alerts")
    public Mono<ResponseEntity<List<CorrelationRecord>>> getCorrelations() {
        return Mono.fromCallable(() -> ResponseEntity.ok(engine.getCorrelations()));
    }
}
