package com.z254.butterfly.sentinel.detection;

import java.time.Instant;
import java.util.List;

/**
 * Independently seeded isolation forests trained on the same series.
 */
public record EnsembleModel(List<IsolationForest> members, int trainingVectors, Instant trainedAt) {

    public EnsembleModel {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }

    /**
     * Majority threshold: {@code floor(k/2) + 1} votes.
     */
    public int majority() {
        return members.size() / 2 + 1;
    }
}
