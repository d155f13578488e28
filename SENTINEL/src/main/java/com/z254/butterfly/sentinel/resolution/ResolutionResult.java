package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.domain.model.IncidentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a resolution workflow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionResult {

    private String workflowId;

    private String incidentId;

    private boolean success;

    /** Terminal incident status the workflow ended in */
    private IncidentStatus finalStatus;

    @Builder.Default
    private List<String> actionsExecuted = new ArrayList<>();

    private Duration resolutionTime;

    private double confidence;

    private ImpactAssessment impactAssessment;

    @Builder.Default
    private List<String> lessonsLearned = new ArrayList<>();

    private boolean requiresHumanReview;

    private String escalationReason;
}
