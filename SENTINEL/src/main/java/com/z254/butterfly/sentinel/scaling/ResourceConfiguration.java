package com.z254.butterfly.sentinel.scaling;

import com.z254.butterfly.sentinel.config.SentinelProperties;

/**
 * Scaling bounds and targets for one service.
 */
public record ResourceConfiguration(String serviceName,
                                    int minInstances,
                                    int maxInstances,
                                    int initialInstances,
                                    double targetCpu,
                                    double targetMemory,
                                    String instanceType,
                                    double costPerHour,
                                    boolean autoScalingEnabled) {

    public ResourceConfiguration {
        if (minInstances < 1 || maxInstances < minInstances) {
            throw new IllegalArgumentException("Invalid instance bounds for " + serviceName
                    + ": min=" + minInstances + ", max=" + maxInstances);
        }
        if (targetCpu <= 0 || targetMemory <= 0) {
            throw new IllegalArgumentException("Utilisation targets must be positive for " + serviceName);
        }
    }

    public static ResourceConfiguration from(String serviceName, SentinelProperties.Scaling.ResourceDefaults defaults) {
        return new ResourceConfiguration(serviceName,
                defaults.getMinInstances(),
                defaults.getMaxInstances(),
                defaults.getInitialInstances(),
                defaults.getTargetCpu(),
                defaults.getTargetMemory(),
                defaults.getInstanceType(),
                defaults.getCostPerHour(),
                defaults.isAutoScalingEnabled());
    }

    public int clamp(int instances) {
        return Math.max(minInstances, Math.min(maxInstances, instances));
    }
}
