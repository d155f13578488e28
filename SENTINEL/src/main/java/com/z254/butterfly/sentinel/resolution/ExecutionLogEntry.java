package com.z254.butterfly.sentinel.resolution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Audit trail entry of a resolution workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogEntry {

    private EntryKind kind;

    private String action;

    private Instant timestamp;

    private boolean success;

    private int attempt;

    private String details;

    @Builder.Default
    private Map<String, Double> metricsBefore = new HashMap<>();

    @Builder.Default
    private Map<String, Double> metricsAfter = new HashMap<>();

    public enum EntryKind {
        TRANSITION,
        ACTION,
        VERIFICATION,
        ROLLBACK
    }
}
