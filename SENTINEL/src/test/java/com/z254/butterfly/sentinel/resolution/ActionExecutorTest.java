package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActionExecutorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T10:00:00Z"), ZoneOffset.UTC);

    private static ActionRequest request(String action, boolean rollback) {
        return ActionRequest.builder()
                .requestId("wf_1-0-1")
                .workflowId("wf_1")
                .incidentId("inc_1")
                .serviceName("checkout")
                .actionType(rollback ? null : ActionType.SCALE_UP)
                .action(action)
                .rollback(rollback)
                .attempt(1)
                .timeout(Duration.ofSeconds(30))
                .build();
    }

    @Test
    void dryRunAlwaysSucceeds() {
        DryRunActionExecutor executor = new DryRunActionExecutor(CLOCK);

        StepVerifier.create(executor.execute(request("scale_down_to_original", true)))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.isDryRun()).isTrue();
                    assertThat(result.getDetails())
                            .containsEntry("action", "scale_down_to_original")
                            .containsEntry("mode", "DRY_RUN");
                })
                .verifyComplete();
    }

    @Nested
    @DisplayName("Connector executor")
    class Connector {

        private final List<ClientRequest> sent = new ArrayList<>();

        private HttpActionExecutor executorReplying(HttpStatus status, String body) {
            WebClient.Builder builder = WebClient.builder().exchangeFunction(clientRequest -> {
                sent.add(clientRequest);
                return Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build());
            });
            SentinelProperties properties = new SentinelProperties();
            properties.getExecutor().setUrl("http://connector:8084");
            return new HttpActionExecutor(builder, properties, CLOCK);
        }

        @Test
        void completedReplyIsSuccess() {
            HttpActionExecutor executor = executorReplying(HttpStatus.OK,
                    "{\"actionId\":\"a1\",\"status\":\"COMPLETED\",\"message\":\"scaled to 3\"}");

            StepVerifier.create(executor.execute(request("scale_up", false)))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getMessage()).isEqualTo("scaled to 3");
                        assertThat(result.getExecutedAt()).isEqualTo(CLOCK.instant());
                    })
                    .verifyComplete();
            assertThat(sent).singleElement().satisfies(clientRequest ->
                    assertThat(clientRequest.url().toString()).isEqualTo("http://connector:8084/api/v1/actions"));
        }

        @Test
        void failedReplyCarriesCriticalFlag() {
            HttpActionExecutor executor = executorReplying(HttpStatus.OK,
                    "{\"status\":\"FAILED\",\"critical\":true,\"error\":\"pod crashloop\"}");

            StepVerifier.create(executor.execute(request("restart_service", false)))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.isCriticalFailure()).isTrue();
                        assertThat(result.getErrorMessage()).isEqualTo("pod crashloop");
                    })
                    .verifyComplete();
        }

        @Test
        void serverErrorIsCritical() {
            HttpActionExecutor executor = executorReplying(HttpStatus.BAD_GATEWAY, "{}");

            StepVerifier.create(executor.execute(request("scale_up", false)))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).isInstanceOf(ActionExecutionException.class);
                        assertThat(((ActionExecutionException) error).isCritical()).isTrue();
                    })
                    .verify();
        }

        @Test
        void clientErrorIsOrdinary() {
            HttpActionExecutor executor = executorReplying(HttpStatus.CONFLICT, "{}");

            StepVerifier.create(executor.execute(request("scale_up", false)))
                    .expectErrorSatisfies(error ->
                            assertThat(((ActionExecutionException) error).isCritical()).isFalse())
                    .verify();
        }

        @Test
        void fallbackTurnsUnreachableConnectorIntoOrdinaryFailure() {
            HttpActionExecutor executor = executorReplying(HttpStatus.OK, "{}");

            StepVerifier.create(executor.executeFallback(request("scale_up", false),
                            new ConnectException("Connection refused")))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.isCriticalFailure()).isFalse();
                        assertThat(result.getErrorMessage()).isEqualTo("Connector unavailable: Connection refused");
                    })
                    .verifyComplete();
        }

        @Test
        void fallbackKeepsCriticalErrors() {
            HttpActionExecutor executor = executorReplying(HttpStatus.OK, "{}");
            ActionExecutionException critical = new ActionExecutionException("Connector rejected", true);

            StepVerifier.create(executor.executeFallback(request("scale_up", false), critical))
                    .expectErrorMatches(error -> error == critical)
                    .verify();
        }
    }
}
