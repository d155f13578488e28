package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.domain.model.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Post-hoc cost and risk of a resolution attempt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactAssessment {

    private int actionsAttempted;

    private int actionsSuccessful;

    private Duration totalDowntime;

    /** minimal, moderate or significant */
    private String performanceImpact;

    /** low, medium or high */
    private String costImpact;

    /** low, medium or high */
    private String riskLevel;

    public static ImpactAssessment of(ResolutionWorkflow workflow) {
        var actions = workflow.getActions();
        var attempts = workflow.entries(ExecutionLogEntry.EntryKind.ACTION);
        long failures = attempts.stream().filter(entry -> !entry.isSuccess()).count();

        String performance = "minimal";
        if (actions.size() > 2) {
            performance = "moderate";
        }
        if (actions.contains(ActionType.FAILOVER) || actions.contains(ActionType.ROLLBACK_DEPLOYMENT)) {
            performance = "significant";
        }

        String cost = "low";
        if (actions.contains(ActionType.SCALE_UP)) {
            cost = "medium";
        }
        if (actions.contains(ActionType.FAILOVER)) {
            cost = "high";
        }

        String risk = failures > 1 ? "high" : failures > 0 ? "medium" : "low";

        Duration downtime = workflow.getStartedAt() != null && workflow.getCompletedAt() != null
                ? Duration.between(workflow.getStartedAt(), workflow.getCompletedAt())
                : Duration.ZERO;

        return ImpactAssessment.builder()
                .actionsAttempted(actions.size())
                .actionsSuccessful((int) attempts.stream().filter(ExecutionLogEntry::isSuccess).count())
                .totalDowntime(downtime)
                .performanceImpact(performance)
                .costImpact(cost)
                .riskLevel(risk)
                .build();
    }
}
