package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs remediation actions through the remediation connector's REST API.
 * <p>
 * A 5xx reply or an explicit {@code critical} flag in the reply is a critical failure; an
 * unreachable connector is reported by the fallback as an ordinary failure.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "sentinel.executor", name = "mode", havingValue = "PRODUCTION")
public class HttpActionExecutor implements ActionExecutor {

    private final WebClient webClient;
    private final SentinelProperties.Executor config;
    private final Clock clock;

    public HttpActionExecutor(WebClient.Builder webClientBuilder,
                              SentinelProperties properties,
                              Clock clock) {
        this.config = properties.getExecutor();
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(config.getUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = "action-executor", fallbackMethod = "executeFallback")
    @Retry(name = "action-executor")
    public Mono<ActionResult> execute(ActionRequest request) {
        log.info("Executing action via connector: requestId={}, action={}, target={}",
                request.getRequestId(), request.getAction(), request.getServiceName());

        ConnectorRequest body = ConnectorRequest.builder()
                .action(request.getAction())
                .rollback(request.isRollback())
                .target(request.getServiceName())
                .incidentId(request.getIncidentId())
                .workflowId(request.getWorkflowId())
                .idempotencyKey(request.getRequestId())
                .parameters(request.getParameters())
                .timeoutMs(request.getTimeout() != null ? request.getTimeout().toMillis() : 0)
                .build();

        return webClient.post()
                .uri(config.getActionPathPrefix())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ConnectorResponse.class)
                .map(this::toActionResult)
                .onErrorMap(WebClientResponseException.class, error -> new ActionExecutionException(
                        "Connector rejected " + request.getAction() + ": " + error.getStatusCode(),
                        error.getStatusCode().is5xxServerError(), error))
                .doOnSuccess(result ->
                        log.info("Connector action result: requestId={}, success={}",
                                request.getRequestId(), result.isSuccess()))
                .doOnError(error ->
                        log.error("Connector action failed: requestId={}, error={}",
                                request.getRequestId(), error.getMessage()));
    }

    /**
     * Fallback when the connector is unavailable.
     */
    public Mono<ActionResult> executeFallback(ActionRequest request, Throwable throwable) {
        if (throwable instanceof ActionExecutionException executionError && executionError.isCritical()) {
            return Mono.error(executionError);
        }
        log.warn("Remediation connector unavailable for request {}: {}",
                request.getRequestId(), throwable.getMessage());
        return Mono.just(ActionResult.failed("Connector unavailable: " + throwable.getMessage(),
                false, clock.instant()));
    }

    private ActionResult toActionResult(ConnectorResponse response) {
        boolean success = "COMPLETED".equals(response.getStatus()) || "SUCCESS".equals(response.getStatus());
        return ActionResult.builder()
                .success(success)
                .criticalFailure(!success && response.isCritical())
                .message(response.getMessage())
                .errorMessage(response.getError())
                .executedAt(clock.instant())
                .details(response.getDetails() != null ? response.getDetails() : new HashMap<>())
                .build();
    }

    // ========== Data Classes ==========

    @Data
    @Builder
    private static class ConnectorRequest {
        private String action;
        private boolean rollback;
        private String target;
        private String incidentId;
        private String workflowId;
        private String idempotencyKey;
        private Map<String, String> parameters;
        private long timeoutMs;
    }

    @Data
    private static class ConnectorResponse {
        private String actionId;
        private String status;
        private boolean critical;
        private String message;
        private String error;
        private Map<String, Object> details;
    }
}
