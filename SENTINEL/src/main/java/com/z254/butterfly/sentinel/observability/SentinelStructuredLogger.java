package com.z254.butterfly.sentinel.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Structured logging utility for SENTINEL.
 * <p>
 * Produces machine-readable lines ({@code message | data={...}}) with MDC context for the
 * service, alert, incident and workflow being processed.
 */
@Slf4j
@Component
public class SentinelStructuredLogger {

    // MDC keys
    public static final String MDC_SERVICE = "service";
    public static final String MDC_ALERT_ID = "alertId";
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_WORKFLOW_ID = "workflowId";
    public static final String MDC_LOOP = "loop";

    private static final long SLOW_OPERATION_MS = 5000;

    /**
     * Log an alert event.
     */
    public void logAlertEvent(String alertId, String service, AlertEventType eventType,
                              String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_ALERT_ID, alertId, MDC_SERVICE, service))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("alertId", alertId);
            logData.put("service", service);

            switch (eventType) {
                case SUPPRESSED -> log.debug("{} | data={}", message, formatLogData(logData));
                case RAISED, CORRELATED, EVICTED -> log.info("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, IncidentEventType eventType, String message) {
        logIncidentEvent(incidentId, eventType, message, null);
    }

    /**
     * Log an incident lifecycle event with details.
     */
    public void logIncidentEvent(String incidentId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_INCIDENT_ID, incidentId))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("incidentId", incidentId);

            switch (eventType) {
                case CREATED, MERGED, CLASSIFIED, RESOLVED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case ESCALATED, FAILED ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a resolution workflow event.
     */
    public void logResolutionEvent(String workflowId, String incidentId,
                                   ResolutionEventType eventType, String message,
                                   Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_WORKFLOW_ID, workflowId,
                MDC_INCIDENT_ID, incidentId != null ? incidentId : ""))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("workflowId", workflowId);
            if (incidentId != null) {
                logData.put("incidentId", incidentId);
            }

            switch (eventType) {
                case STARTED, ACTION_SUCCEEDED, VERIFIED, COMPLETED, ROLLED_BACK ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case ACTION_FAILED, ACTION_TIMED_OUT, ROLLBACK_FAILED, ESCALATED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a scaling event.
     */
    public void logScalingEvent(String service, ScalingEventType eventType,
                                String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_SERVICE, service))) {
            Map<String, Object> logData = baseData(eventType.name(), details);
            logData.put("service", service);

            switch (eventType) {
                case DECIDED, EXECUTED -> log.info("{} | data={}", message, formatLogData(logData));
                case EXECUTION_FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case COOLDOWN, LOW_CONFIDENCE -> log.debug("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a performance metric.
     */
    public void logPerformance(String operation, Duration duration, boolean success,
                               Map<String, Object> details) {
        Map<String, Object> logData = baseData("PERFORMANCE", details);
        logData.put("operation", operation);
        logData.put("durationMs", duration.toMillis());
        logData.put("success", success);

        if (duration.toMillis() > SLOW_OPERATION_MS) {
            log.warn("Slow operation: {} took {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        } else {
            log.debug("Performance: {} completed in {}ms | data={}",
                    operation, duration.toMillis(), formatLogData(logData));
        }
    }

    /**
     * Execute a timed operation with logging.
     */
    public <T> T timed(String operation, Supplier<T> action) {
        Instant start = Instant.now();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            logPerformance(operation, Duration.between(start, Instant.now()), success, null);
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    /**
     * Tag the current thread with the loop it is running.
     */
    public MDCScope withLoop(String loop) {
        MDC.put(MDC_LOOP, loop);
        return new MDCScope(MDC_LOOP);
    }

    private Map<String, Object> baseData(String event, Map<String, Object> details) {
        Map<String, Object> logData = new HashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum AlertEventType {
        RAISED, SUPPRESSED, CORRELATED, EVICTED
    }

    public enum IncidentEventType {
        CREATED, MERGED, CLASSIFIED, RESOLVING, RESOLVED, ESCALATED, FAILED
    }

    public enum ResolutionEventType {
        STARTED, ACTION_SUCCEEDED, ACTION_FAILED, ACTION_TIMED_OUT, VERIFIED,
        ROLLED_BACK, ROLLBACK_FAILED, ESCALATED, COMPLETED, FAILED
    }

    public enum ScalingEventType {
        DECIDED, EXECUTED, EXECUTION_FAILED, COOLDOWN, LOW_CONFIDENCE
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
