package com.z254.butterfly.sentinel.resolution;

/**
 * A second resolution was requested for an incident whose workflow is still running.
 */
public class WorkflowAlreadyActiveException extends RuntimeException {

    private final String incidentId;

    public WorkflowAlreadyActiveException(String incidentId, String activeWorkflowId) {
        super("Incident " + incidentId + " already has active workflow " + activeWorkflowId);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
