package com.z254.butterfly.sentinel.domain.service;

import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deployment history per service, reported by the delivery pipeline. Feeds the incident
 * context (service version, recent deployments) used to prefer rollbacks.
 */
@Service
public class DeploymentRegistry {

    static final int HISTORY_PER_SERVICE = 20;

    private final Map<String, Deque<Deployment>> deployments = new ConcurrentHashMap<>();

    public void recordDeployment(String service, String version, Instant deployedAt) {
        if (service == null || service.isBlank() || version == null || version.isBlank()) {
            throw new IllegalArgumentException("service and version are required");
        }
        Deque<Deployment> history = deployments.computeIfAbsent(service, s -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(new Deployment(version, deployedAt));
            while (history.size() > HISTORY_PER_SERVICE) {
                history.removeFirst();
            }
        }
    }

    public Optional<String> currentVersion(String service) {
        Deque<Deployment> history = deployments.get(service);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return Optional.ofNullable(history.peekLast()).map(Deployment::version);
        }
    }

    /**
     * Versions deployed inside {@code window} before {@code now}, oldest first.
     */
    public List<String> recentDeployments(String service, Duration window, Instant now) {
        Deque<Deployment> history = deployments.get(service);
        if (history == null) {
            return List.of();
        }
        Instant cutoff = now.minus(window);
        synchronized (history) {
            return history.stream()
                    .filter(deployment -> !deployment.deployedAt().isBefore(cutoff))
                    .map(Deployment::version)
                    .toList();
        }
    }

    public record Deployment(String version, Instant deployedAt) {
    }
}
