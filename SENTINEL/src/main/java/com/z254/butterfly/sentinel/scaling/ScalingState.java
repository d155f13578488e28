package com.z254.butterfly.sentinel.scaling;

import java.time.Duration;
import java.time.Instant;

/**
 * Scaling view of one service.
 *
 * @param cooldownRemaining zero when the service may scale again
 * @param lastDecision      null before the first executed decision
 */
public record ScalingState(ResourceConfiguration configuration,
                           int currentInstances,
                           ScalingDecision lastDecision,
                           Instant lastExecutedAt,
                           Duration cooldownRemaining,
                           Double cpuUtilization,
                           Double memoryUtilization) {

    public boolean inCooldown() {
        return !cooldownRemaining.isZero();
    }
}
