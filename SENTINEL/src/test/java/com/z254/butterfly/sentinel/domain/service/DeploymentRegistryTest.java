package com.z254.butterfly.sentinel.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentRegistryTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private final DeploymentRegistry registry = new DeploymentRegistry();

    @Test
    void latestDeploymentIsTheCurrentVersion() {
        registry.recordDeployment("checkout", "2.4.0", NOW.minus(Duration.ofDays(1)));
        registry.recordDeployment("checkout", "2.4.1", NOW.minus(Duration.ofMinutes(30)));

        assertThat(registry.currentVersion("checkout")).contains("2.4.1");
        assertThat(registry.currentVersion("search")).isEmpty();
    }

    @Test
    void recentDeploymentsRespectTheWindow() {
        registry.recordDeployment("checkout", "2.4.0", NOW.minus(Duration.ofHours(3)));
        registry.recordDeployment("checkout", "2.4.1", NOW.minus(Duration.ofMinutes(90)));
        registry.recordDeployment("checkout", "2.4.2", NOW.minus(Duration.ofMinutes(5)));

        assertThat(registry.recentDeployments("checkout", Duration.ofHours(2), NOW)).containsExactly("2.4.1", "2.4.2");
        assertThat(registry.recentDeployments("search", Duration.ofHours(2), NOW)).isEmpty();
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < 25; i++) {
            registry.recordDeployment("checkout", "1.0." + i, NOW.plusSeconds(i));
        }

        assertThat(registry.recentDeployments("checkout", Duration.ofDays(1), NOW.plusSeconds(30)))
                .hasSize(20)
                .startsWith("1.0.5");
    }

    @Test
    void versionIsRequired() {
        assertThatThrownBy(() -> registry.recordDeployment("checkout", " ", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
