package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResolutionPlannerTest {

    private ActionRecommender recommender;
    private KnowledgeBase knowledgeBase;
    private ResolutionPlanner planner;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        recommender = new ActionRecommender(properties);
        knowledgeBase = new KnowledgeBase();
        planner = new ResolutionPlanner(recommender, knowledgeBase, properties);
    }

    @Nested
    @DisplayName("Action selection")
    class Selection {

        @Test
        void highCpuScalesBeforeRestarting() {
            ResolutionPlan plan = planner.plan(incident(IncidentType.HIGH_CPU_UTILIZATION, IncidentSeverity.HIGH,
                    IncidentMetrics.builder().cpuUsage(0.93).build(), IncidentContext.builder().build()));

            assertThat(plan.actions()).containsExactly(ActionType.SCALE_UP, ActionType.RESTART_SERVICE);
            assertThat(plan.rollbackActions()).containsExactly("scale_down_to_original", "restore_previous_state");
            assertThat(plan.successProbability()).isCloseTo(0.4, within(1e-9));
            assertThat(plan.incidentId()).isEqualTo("INC-1");
        }

        @Test
        void errorsAfterADeploymentAreRolledBack() {
            IncidentContext deployed = IncidentContext.builder()
                    .recentDeployments(new ArrayList<>(List.of("2.4.1")))
                    .build();

            ResolutionPlan plan = planner.plan(incident(IncidentType.CRITICAL_ERROR_RATE, IncidentSeverity.CRITICAL,
                    IncidentMetrics.builder().errorRate(0.6).build(), deployed));

            assertThat(plan.actions()).containsExactly(ActionType.ROLLBACK_DEPLOYMENT);
            assertThat(plan.successProbability()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void errorsWithoutADeploymentRestartAndBreakTheCircuit() {
            ResolutionPlan plan = planner.plan(incident(IncidentType.CRITICAL_ERROR_RATE, IncidentSeverity.CRITICAL,
                    IncidentMetrics.builder().errorRate(0.6).build(), IncidentContext.builder().build()));

            assertThat(plan.actions()).containsExactly(ActionType.CIRCUIT_BREAKER, ActionType.RESTART_SERVICE);
        }

        @Test
        void planIsCappedAtThreeActions() {
            IncidentMetrics everything = IncidentMetrics.builder()
                    .cpuUsage(0.9).memoryUsage(0.95).responseTime(4000.0).diskUsage(0.95).build();

            ResolutionPlan plan = planner.plan(incident(IncidentType.RESOURCE_CONTENTION, IncidentSeverity.MEDIUM,
                    everything, IncidentContext.builder().build()));

            assertThat(plan.actions()).containsExactly(ActionType.CLEAR_CACHE, ActionType.RESTART_SERVICE,
                    ActionType.SCALE_UP);
            assertThat(plan.successProbability()).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void learnedRecommendationsJoinThePlan() {
            for (int i = 0; i < 5; i++) {
                recommender.recordOutcome(IncidentType.HIGH_CPU_UTILIZATION, ActionType.CLEAR_CACHE, true);
            }

            ResolutionPlan plan = planner.plan(incident(IncidentType.HIGH_CPU_UTILIZATION, IncidentSeverity.HIGH,
                    IncidentMetrics.builder().cpuUsage(0.93).build(), IncidentContext.builder().build()));

            assertThat(plan.actions()).containsExactly(ActionType.SCALE_UP, ActionType.RESTART_SERVICE,
                    ActionType.CLEAR_CACHE);
            assertThat(plan.successProbability()).isCloseTo(0.3, within(1e-9));
        }

        @Test
        void nothingToDoYieldsAnEmptyPlan() {
            ResolutionPlan plan = planner.plan(incident(IncidentType.QUEUE_BUILDUP, IncidentSeverity.LOW,
                    IncidentMetrics.builder().queueDepth(150.0).build(), IncidentContext.builder().build()));

            assertThat(plan.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Success probability")
    class Probability {

        @Test
        void easyTypesAreClampedAtTheCeiling() {
            Incident incident = incident(IncidentType.QUEUE_BUILDUP, IncidentSeverity.LOW,
                    IncidentMetrics.builder().build(), IncidentContext.builder().build());

            assertThat(ResolutionPlanner.successProbability(incident, List.of(ActionType.CLEAR_CACHE))).isEqualTo(0.9);
        }

        @Test
        void hardCriticalTypesStartLow() {
            Incident incident = incident(IncidentType.MEMORY_LEAK, IncidentSeverity.CRITICAL,
                    IncidentMetrics.builder().build(), IncidentContext.builder().build());

            assertThat(ResolutionPlanner.successProbability(incident, List.of(ActionType.RESTART_SERVICE)))
                    .isCloseTo(0.15, within(1e-9));
        }

        @Test
        void neverBelowTheFloor() {
            Incident incident = incident(IncidentType.NETWORK_TIMEOUT, IncidentSeverity.CRITICAL,
                    IncidentMetrics.builder().build(), IncidentContext.builder().build());

            assertThat(ResolutionPlanner.successProbability(incident, List.of(ActionType.RESET_CONNECTIONS,
                    ActionType.FAILOVER, ActionType.RESTART_SERVICE, ActionType.SCALE_UP))).isEqualTo(0.1);
        }
    }

    @Test
    void knowledgeBaseIsSeededAndLearnsWithoutDuplicates() {
        assertThat(knowledgeBase.lookup(IncidentType.MEMORY_LEAK)).containsExactly(ActionType.RESTART_SERVICE);
        assertThat(knowledgeBase.lookup(IncidentType.QUEUE_BUILDUP)).isEmpty();

        knowledgeBase.learn(IncidentType.MEMORY_LEAK, ActionType.SCALE_UP);
        knowledgeBase.learn(IncidentType.MEMORY_LEAK, ActionType.SCALE_UP);

        assertThat(knowledgeBase.lookup(IncidentType.MEMORY_LEAK))
                .containsExactly(ActionType.RESTART_SERVICE, ActionType.SCALE_UP);
    }

    private static Incident incident(IncidentType type, IncidentSeverity severity, IncidentMetrics metrics,
                                     IncidentContext context) {
        return Incident.builder()
                .id("INC-1")
                .serviceName("checkout")
                .type(type)
                .severity(severity)
                .metricsSnapshot(metrics)
                .context(context)
                .build();
    }
}
