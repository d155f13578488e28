package com.z254.butterfly.sentinel.health;

import java.time.Instant;

/**
 * Weighted health of one service, each score in [0, 100].
 *
 * @param sampleVersion buffer version of the service the score was computed from
 */
public record ServiceHealthScore(String serviceName,
                                 double overallScore,
                                 double performanceScore,
                                 double reliabilityScore,
                                 double resourceScore,
                                 double errorScore,
                                 HealthStatus status,
                                 Instant lastUpdated,
                                 long sampleVersion) {

    public static ServiceHealthScore noData(String serviceName, Instant now, long version) {
        return new ServiceHealthScore(serviceName, 0, 0, 0, 0, 0, HealthStatus.DOWN, now, version);
    }
}
