package com.z254.butterfly.sentinel.engine;

import java.time.Instant;

/**
 * Point-in-time counters across the engine.
 */
public record SystemStats(int servicesTracked,
                          int seriesTracked,
                          long samplesBuffered,
                          long samplesDropped,
                          int ingestionQueueDepth,
                          int alertsBuffered,
                          int activeIncidents,
                          int activeWorkflows,
                          int correlationRecords,
                          int capacityForecasts,
                          int detectionModels,
                          boolean classifierTrained,
                          Instant generatedAt) {
}
