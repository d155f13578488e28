package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.config.SentinelProperties;
import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.Incident;
import com.z254.butterfly.sentinel.domain.model.IncidentContext;
import com.z254.butterfly.sentinel.domain.model.IncidentMetrics;
import com.z254.butterfly.sentinel.domain.model.IncidentSeverity;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Builds the ranked action plan for an incident.
 * <p>
 * Candidates come from the learned recommender, the knowledge base and the threshold rules,
 * in that order, are reordered by the severity's priority list and capped at
 * {@code maxPlanLength}.
 */
@Slf4j
@Component
public class ResolutionPlanner {

    static final double BASE_PROBABILITY = 0.5;
    static final double MIN_PROBABILITY = 0.1;
    static final double MAX_PROBABILITY = 0.9;

    private static final Set<IncidentType> EASY_TYPES = EnumSet.of(
            IncidentType.CACHE_OVERFLOW, IncidentType.QUEUE_BUILDUP, IncidentType.SLOW_RESPONSE_TIME);
    private static final Set<IncidentType> HARD_TYPES = EnumSet.of(
            IncidentType.MEMORY_LEAK, IncidentType.DATABASE_CONNECTION_ERROR, IncidentType.NETWORK_TIMEOUT);

    private static final List<ActionType> CRITICAL_PRIORITY = List.of(
            ActionType.FAILOVER, ActionType.CIRCUIT_BREAKER, ActionType.SCALE_UP,
            ActionType.RESTART_SERVICE, ActionType.ROLLBACK_DEPLOYMENT);
    private static final List<ActionType> HIGH_PRIORITY = List.of(
            ActionType.SCALE_UP, ActionType.RESTART_SERVICE, ActionType.ROLLBACK_DEPLOYMENT,
            ActionType.CLEAR_CACHE, ActionType.RESET_CONNECTIONS);
    private static final List<ActionType> DEFAULT_PRIORITY = List.of(
            ActionType.CLEAR_CACHE, ActionType.RESTART_SERVICE, ActionType.RESET_CONNECTIONS,
            ActionType.SCALE_UP, ActionType.GRACEFUL_SHUTDOWN);

    private final ActionRecommender recommender;
    private final KnowledgeBase knowledgeBase;
    private final int maxPlanLength;

    public ResolutionPlanner(ActionRecommender recommender, KnowledgeBase knowledgeBase,
                             SentinelProperties properties) {
        this.recommender = recommender;
        this.knowledgeBase = knowledgeBase;
        this.maxPlanLength = properties.getResolution().getMaxPlanLength();
    }

    public ResolutionPlan plan(Incident incident) {
        Set<ActionType> candidates = new LinkedHashSet<>();
        candidates.addAll(recommender.recommend(incident.getType()));
        candidates.addAll(knowledgeBase.lookup(incident.getType()));
        candidates.addAll(ruleBasedActions(incident));

        List<ActionType> actions = prioritize(new ArrayList<>(candidates), incident.getSeverity());
        if (actions.size() > maxPlanLength) {
            actions = actions.subList(0, maxPlanLength);
        }

        double probability = successProbability(incident, actions);
        List<String> rollbacks = actions.stream().map(ActionType::rollbackName).toList();

        log.info("Resolution planned for {}: actions={}, successProbability={}",
                incident.getId(), actions, String.format("%.2f", probability));
        return new ResolutionPlan(incident.getId(), actions, probability, rollbacks);
    }

    // ========== Planning Rules ==========

    static List<ActionType> ruleBasedActions(Incident incident) {
        IncidentMetrics m = incident.getMetricsSnapshot() != null
                ? incident.getMetricsSnapshot() : IncidentMetrics.builder().build();
        IncidentContext context = incident.getContext() != null
                ? incident.getContext() : IncidentContext.builder().build();
        String type = incident.getType().code();

        Set<ActionType> actions = new LinkedHashSet<>();
        if (m.cpu() > 0.8) {
            actions.add(ActionType.SCALE_UP);
            actions.add(ActionType.RESTART_SERVICE);
        }
        if (m.memory() > 0.9) {
            actions.add(ActionType.RESTART_SERVICE);
            actions.add(ActionType.CLEAR_CACHE);
        }
        if (m.errors() > 0.1) {
            if (context.hasRecentDeployment()) {
                actions.add(ActionType.ROLLBACK_DEPLOYMENT);
            } else {
                actions.add(ActionType.RESTART_SERVICE);
                actions.add(ActionType.CIRCUIT_BREAKER);
            }
        }
        if (m.responseTimeMs() > 3000) {
            actions.add(ActionType.CLEAR_CACHE);
            actions.add(ActionType.SCALE_UP);
        }
        if (m.disk() > 0.9) {
            actions.add(ActionType.CLEAR_CACHE);
            actions.add(ActionType.GRACEFUL_SHUTDOWN);
        }
        if (type.contains("database")) {
            actions.add(ActionType.RESET_CONNECTIONS);
            actions.add(ActionType.RESTART_SERVICE);
        }
        if (type.contains("network") || type.contains("timeout")) {
            actions.add(ActionType.RESET_CONNECTIONS);
            actions.add(ActionType.FAILOVER);
        }
        return new ArrayList<>(actions);
    }

    static List<ActionType> prioritize(List<ActionType> actions, IncidentSeverity severity) {
        List<ActionType> order = switch (severity) {
            case CRITICAL -> CRITICAL_PRIORITY;
            case HIGH -> HIGH_PRIORITY;
            default -> DEFAULT_PRIORITY;
        };
        List<ActionType> prioritized = new ArrayList<>();
        for (ActionType preferred : order) {
            if (actions.contains(preferred)) {
                prioritized.add(preferred);
            }
        }
        for (ActionType action : actions) {
            if (!prioritized.contains(action)) {
                prioritized.add(action);
            }
        }
        return prioritized;
    }

    static double successProbability(Incident incident, List<ActionType> actions) {
        double probability = BASE_PROBABILITY + switch (incident.getSeverity()) {
            case LOW -> 0.3;
            case MEDIUM -> 0.1;
            case HIGH -> -0.1;
            case CRITICAL -> -0.2;
        };
        if (actions.size() > 2) {
            probability -= 0.1 * (actions.size() - 2);
        }
        if (EASY_TYPES.contains(incident.getType())) {
            probability += 0.2;
        } else if (HARD_TYPES.contains(incident.getType())) {
            probability -= 0.15;
        }
        boolean recentDeployment = incident.getContext() != null && incident.getContext().hasRecentDeployment();
        if (recentDeployment && actions.contains(ActionType.ROLLBACK_DEPLOYMENT)) {
            probability += 0.2;
        }
        return Math.max(MIN_PROBABILITY, Math.min(MAX_PROBABILITY, probability));
    }
}
