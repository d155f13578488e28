package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionVerifierTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private final TelemetryBuffer buffer = new TelemetryBuffer(100);
    private final ResolutionVerifier verifier = new ResolutionVerifier(buffer, Clock.fixed(NOW, ZoneOffset.UTC));

    @ParameterizedTest
    @CsvSource({
            "HIGH_CPU_UTILIZATION,     cpu_usage,        0.79,  true",
            "HIGH_CPU_UTILIZATION,     cpu_usage,        0.80,  false",
            "CRITICAL_MEMORY_USAGE,    memory_usage,     0.84,  true",
            "MEMORY_LEAK,              memory_usage,     0.86,  false",
            "ELEVATED_ERROR_RATE,      error_rate,       0.04,  true",
            "CRITICAL_ERROR_RATE,      error_rate,       0.05,  false",
            "SLOW_RESPONSE_TIME,       response_time_ms, 1999,  true",
            "HIGH_RESPONSE_TIME,       response_time_ms, 2500,  false",
            "QUEUE_BUILDUP,            queue_depth,      150,   false",
            "QUEUE_BUILDUP,            queue_depth,      40,    true",
    })
    void recoveryThresholds(IncidentType type, String metric, double value, boolean resolved) {
        assertThat(verifier.isResolved(incident(type), Map.of(metric, value))).isEqualTo(resolved);
    }

    @Test
    void typesWithoutOwnConditionNeedEveryConditionCleared() {
        Incident incident = incident(IncidentType.DATABASE_CONNECTION_ERROR);

        assertThat(verifier.isResolved(incident, Map.of("cpu_usage", 0.5, "error_rate", 0.01))).isTrue();
        assertThat(verifier.isResolved(incident, Map.of("cpu_usage", 0.5, "error_rate", 0.2))).isFalse();
    }

    @Test
    void throughputDegradationDependsOnLoadPattern() {
        Incident spiking = incident(IncidentType.THROUGHPUT_DEGRADATION);
        spiking.setContext(IncidentContext.builder().loadPattern(IncidentContext.LOAD_SPIKE).build());
        Incident normal = incident(IncidentType.THROUGHPUT_DEGRADATION);

        assertThat(verifier.isResolved(spiking, Map.of("request_rate", 5.0))).isFalse();
        assertThat(verifier.isResolved(normal, Map.of("request_rate", 5.0))).isTrue();
    }

    @Test
    void captureReadsLatestValues() {
        buffer.ingest("checkout", "cpu_usage", 0.9, NOW.minusSeconds(60));
        buffer.ingest("checkout", "cpu_usage", 0.4, NOW);
        buffer.ingest("checkout", "error_rate", 0.01, NOW);

        assertThat(verifier.capture("checkout"))
                .containsEntry("cpu_usage", 0.4)
                .containsEntry("error_rate", 0.01);
        assertThat(verifier.capture("unknown")).isEmpty();
    }

    private static Incident incident(IncidentType type) {
        return Incident.builder()
                .id("inc_test")
                .serviceName("checkout")
                .type(type)
                .severity(IncidentSeverity.HIGH)
                .build();
    }
}
