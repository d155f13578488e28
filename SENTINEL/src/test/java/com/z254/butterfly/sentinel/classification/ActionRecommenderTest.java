package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ActionRecommenderTest {

    private final ActionRecommender recommender = new ActionRecommender(new SentinelProperties());

    @Test
    void staysSilentUntilTheTypeHasEnoughOutcomes() {
        for (int i = 0; i < 4; i++) {
            recommender.recordOutcome(IncidentType.HIGH_CPU_UTILIZATION, ActionType.SCALE_UP, true);
        }

        assertThat(recommender.isTrained(IncidentType.HIGH_CPU_UTILIZATION)).isFalse();
        assertThat(recommender.recommend(IncidentType.HIGH_CPU_UTILIZATION)).isEmpty();
        assertThat(recommender.successRate(IncidentType.HIGH_CPU_UTILIZATION, ActionType.SCALE_UP)).isEqualTo(1.0);
    }

    @Test
    void ranksActionsBySuccessRateAboveTheCut() {
        record(ActionType.SCALE_UP, true, true, true);
        record(ActionType.RESTART_SERVICE, true, false);
        record(ActionType.CLEAR_CACHE, false, false, false);

        assertThat(recommender.recommend(IncidentType.HIGH_CPU_UTILIZATION))
                .containsExactly(ActionType.SCALE_UP, ActionType.RESTART_SERVICE);
        assertThat(recommender.successRate(IncidentType.HIGH_CPU_UTILIZATION, ActionType.RESTART_SERVICE))
                .isEqualTo(0.5);
        assertThat(recommender.successRate(IncidentType.MEMORY_LEAK, ActionType.RESTART_SERVICE)).isZero();
    }

    @Test
    void offersAtMostThreeActions() {
        record(ActionType.SCALE_UP, true, true);
        record(ActionType.RESTART_SERVICE, true, true);
        record(ActionType.CLEAR_CACHE, true);
        record(ActionType.RESET_CONNECTIONS, true);

        assertThat(recommender.recommend(IncidentType.HIGH_CPU_UTILIZATION)).hasSize(3);
    }

    private void record(ActionType action, boolean... outcomes) {
        for (boolean success : outcomes) {
            recommender.recordOutcome(IncidentType.HIGH_CPU_UTILIZATION, action, success);
        }
    }
}
