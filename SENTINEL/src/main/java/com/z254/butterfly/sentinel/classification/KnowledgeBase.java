package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.domain.model.ActionType;
import com.z254.butterfly.sentinel.domain.model.IncidentType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Known-good actions per incident type. Seeded with the standard remedies and extended with
 * every action that verifiably resolved an incident.
 */
@Component
public class KnowledgeBase {

    private final Map<IncidentType, CopyOnWriteArrayList<ActionType>> entries = new ConcurrentHashMap<>();

    public KnowledgeBase() {
        learn(IncidentType.HIGH_CPU_UTILIZATION, ActionType.SCALE_UP);
        learn(IncidentType.MEMORY_LEAK, ActionType.RESTART_SERVICE);
        learn(IncidentType.DATABASE_CONNECTION_ERROR, ActionType.RESET_CONNECTIONS);
        learn(IncidentType.CACHE_OVERFLOW, ActionType.CLEAR_CACHE);
        learn(IncidentType.API_RATE_LIMIT_EXCEEDED, ActionType.CIRCUIT_BREAKER);
    }

    public List<ActionType> lookup(IncidentType type) {
        List<ActionType> actions = entries.get(type);
        return actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Remember an action that resolved an incident of this type.
     */
    public void learn(IncidentType type, ActionType action) {
        entries.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).addIfAbsent(action);
    }
}
