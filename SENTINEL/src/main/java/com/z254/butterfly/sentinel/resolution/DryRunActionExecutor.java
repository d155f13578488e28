package com.z254.butterfly.sentinel.resolution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Logs the action instead of running it. Always succeeds.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.executor", name = "mode", havingValue = "DRY_RUN", matchIfMissing = true)
public class DryRunActionExecutor implements ActionExecutor {

    private final Clock clock;

    public DryRunActionExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<ActionResult> execute(ActionRequest request) {
        log.info("DRY_RUN: Would execute {}{} on {} (incident={}, attempt={})",
                request.getAction(), request.isRollback() ? " (rollback)" : "",
                request.getServiceName(), request.getIncidentId(), request.getAttempt());

        return Mono.just(ActionResult.builder()
                .success(true)
                .message("Dry run completed successfully")
                .executedAt(clock.instant())
                .dryRun(true)
                .details(Map.of(
                        "action", request.getAction(),
                        "target", request.getServiceName(),
                        "mode", "DRY_RUN"))
                .build());
    }
}
