package com.z254.butterfly.sentinel.resolution;

/**
 * A remediation action failed. Critical failures trigger rollback of the workflow.
 */
public class ActionExecutionException extends RuntimeException {

    private final boolean critical;

    public ActionExecutionException(String message, boolean critical) {
        super(message);
        this.critical = critical;
    }

    public ActionExecutionException(String message, boolean critical, Throwable cause) {
        super(message, cause);
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
