package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Learns per-type action success rates from executed workflows.
 * <p>
 * Recommendations for a type are only offered once it has at least
 * {@code minTrainingSamplesPerClass} recorded outcomes.
 */
@Component
public class ActionRecommender {

    static final int MAX_RECOMMENDATIONS = 3;

    private final double confidenceCut;
    private final int minSamples;

    private final Map<IncidentType, Map<ActionType, Outcomes>> outcomes = new ConcurrentHashMap<>();

    public ActionRecommender(SentinelProperties properties) {
        this.confidenceCut = properties.getResolution().getRecommenderConfidenceCut();
        this.minSamples = properties.getResolution().getMinTrainingSamplesPerClass();
    }

    public void recordOutcome(IncidentType type, ActionType action, boolean success) {
        Outcomes counts = outcomes
                .computeIfAbsent(type, t -> new ConcurrentHashMap<>())
                .computeIfAbsent(action, a -> new Outcomes());
        counts.attempts.incrementAndGet();
        if (success) {
            counts.successes.incrementAndGet();
        }
    }

    /**
     * Up to three actions with the highest learned success rate above the cut.
     */
    public List<ActionType> recommend(IncidentType type) {
        Map<ActionType, Outcomes> byAction = outcomes.get(type);
        if (byAction == null || !isTrained(type)) {
            return List.of();
        }
        return byAction.entrySet().stream()
                .filter(entry -> entry.getValue().rate() > confidenceCut)
                .sorted(Map.Entry.<ActionType, Outcomes>comparingByValue(
                        Comparator.comparingDouble(Outcomes::rate)).reversed())
                .limit(MAX_RECOMMENDATIONS)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isTrained(IncidentType type) {
        Map<ActionType, Outcomes> byAction = outcomes.get(type);
        if (byAction == null) {
            return false;
        }
        int total = byAction.values().stream().mapToInt(o -> o.attempts.get()).sum();
        return total >= minSamples;
    }

    public double successRate(IncidentType type, ActionType action) {
        Map<ActionType, Outcomes> byAction = outcomes.get(type);
        if (byAction == null || !byAction.containsKey(action)) {
            return 0.0;
        }
        return byAction.get(action).rate();
    }

    private static final class Outcomes {
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger successes = new AtomicInteger();

        double rate() {
            int n = attempts.get();
            return n == 0 ? 0.0 : (double) successes.get() / n;
        }
    }
}
