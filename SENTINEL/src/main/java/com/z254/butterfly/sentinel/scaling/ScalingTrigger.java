package com.z254.butterfly.sentinel.scaling;

/**
 * What drove a scaling decision.
 */
public enum ScalingTrigger {
    /** Forecast peak of the load metric */
    PREDICTED_LOAD,
    /** CPU or memory utilisation against target, no load forecast available */
    CURRENT_UTILIZATION,
    /** Fewer instances suffice */
    COST_OPTIMIZATION
}
