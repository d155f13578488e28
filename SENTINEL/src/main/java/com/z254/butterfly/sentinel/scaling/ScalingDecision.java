package com.z254.butterfly.sentinel.scaling;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scaling evaluation, handed to the {@link ScalingExecutor} and then archived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingDecision {

    private String id;

    private String serviceName;

    private int currentInstances;

    /** Always within the service's instance bounds */
    private int targetInstances;

    private ScalingDirection direction;

    private double predictedLoad;

    private double confidence;

    /** Hourly cost delta */
    private double costImpact;

    /** Expected relative performance change */
    private double performanceImpact;

    private ScalingTrigger trigger;

    private Instant decidedAt;

    private Instant executeAt;

    @Builder.Default
    private Map<String, Double> rollbackCriteria = new LinkedHashMap<>();

    private boolean executed;

    private boolean executionSucceeded;
}
