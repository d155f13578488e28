package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.domain.model.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * One remediation or compensating action to run against a service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionRequest {

    /** Idempotency key, unique per attempt */
    private String requestId;

    private String workflowId;

    private String incidentId;

    private String serviceName;

    /** Planned action; null for compensating actions */
    private ActionType actionType;

    /** Action code, or the compensating action name when {@link #rollback} is set */
    private String action;

    private boolean rollback;

    private int attempt;

    private Duration timeout;

    @Builder.Default
    private Map<String, String> parameters = new HashMap<>();
}
