package com.z254.butterfly.sentinel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SENTINEL - Autonomic Operations Engine for the BUTTERFLY Ecosystem.
 *
 * <p>SENTINEL closes the operations loop:
 * <ul>
 *   <li>Telemetry intake - bounded per-series history fed by a drop-oldest ingestion queue</li>
 *   <li>Anomaly detection - isolation-forest ensemble with a statistical fallback</li>
 *   <li>Forecasting - trend/seasonal projection and capacity exhaustion estimates</li>
 *   <li>Alerting - severity ranking, deduplication and correlation</li>
 *   <li>Self-healing - incident classification, remediation workflows, rollback and escalation</li>
 *   <li>Predictive scaling - cooldown-guarded scale decisions</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SentinelApplication {

    public static void main(String[] args) {
        SpringApplication.run(SentinelApplication.class, args);
    }
}
