package com.z254.butterfly.sentinel.classification;

import com.z254.butterfly.sentinel.domain.model.ActionType;

import java.util.List;

/**
 * Ranked actions for one incident with the estimated chance they resolve it.
 *
 * @param rollbackActions compensating action name for each planned action, same order
 */
public record ResolutionPlan(String incidentId,
                             List<ActionType> actions,
                             double successProbability,
                             List<String> rollbackActions) {

    public ResolutionPlan {
        actions = List.copyOf(actions);
        rollbackActions = List.copyOf(rollbackActions);
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }
}
