package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.classification.DetectionCondition;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import com.z254.butterfly.sentinel.telemetry.TelemetryBuffer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Decides from fresh telemetry whether an incident is resolved.
 */
@Component
public class ResolutionVerifier {

    static final double CPU_RECOVERED = 0.8;
    static final double MEMORY_RECOVERED = 0.85;
    static final double ERROR_RATE_RECOVERED = 0.05;
    static final double RESPONSE_TIME_RECOVERED_MS = 2000;

    private final TelemetryBuffer buffer;
    private final Clock clock;

    public ResolutionVerifier(TelemetryBuffer buffer, Clock clock) {
        this.buffer = buffer;
        this.clock = clock;
    }

    /**
     * Latest value of every metric the service reports.
     */
    public Map<String, Double> capture(String serviceName) {
        return buffer.latestValues(serviceName);
    }

    public boolean isResolved(Incident incident, Map<String, Double> latestValues) {
        IncidentMetrics current = IncidentMetrics.fromLatest(latestValues, clock.instant());
        IncidentContext context = incident.getContext() != null
                ? incident.getContext() : IncidentContext.builder().build();
        return predicateFor(incident.getType(), context).test(current);
    }

    static Predicate<IncidentMetrics> predicateFor(IncidentType type, IncidentContext context) {
        return switch (type) {
            case CRITICAL_CPU_UTILIZATION, HIGH_CPU_UTILIZATION -> m -> m.cpu() < CPU_RECOVERED;
            case CRITICAL_MEMORY_USAGE, HIGH_MEMORY_USAGE, MEMORY_LEAK -> m -> m.memory() < MEMORY_RECOVERED;
            case CRITICAL_ERROR_RATE, HIGH_ERROR_RATE, ELEVATED_ERROR_RATE -> m -> m.errors() < ERROR_RATE_RECOVERED;
            case CRITICAL_RESPONSE_TIME, HIGH_RESPONSE_TIME, SLOW_RESPONSE_TIME ->
                    m -> m.responseTimeMs() < RESPONSE_TIME_RECOVERED_MS;
            default -> conditionsCleared(type, context);
        };
    }

    /**
     * The conditions that open this type no longer hold. Types no condition produces count as
     * resolved once no metric-driven condition holds.
     */
    private static Predicate<IncidentMetrics> conditionsCleared(IncidentType type, IncidentContext context) {
        DetectionCondition[] own = Arrays.stream(DetectionCondition.values())
                .filter(condition -> condition.getType() == type)
                .toArray(DetectionCondition[]::new);
        DetectionCondition[] relevant = own.length > 0 ? own : Arrays.stream(DetectionCondition.values())
                .filter(condition -> condition != DetectionCondition.MULTIPLE_ALERTS)
                .toArray(DetectionCondition[]::new);
        return m -> Arrays.stream(relevant).noneMatch(condition -> condition.matches(m, context));
    }
}
