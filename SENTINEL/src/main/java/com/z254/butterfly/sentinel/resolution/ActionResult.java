package com.z254.butterfly.sentinel.resolution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {

    private boolean success;

    /** Failure that leaves the service in an unknown state; triggers rollback */
    private boolean criticalFailure;

    private String message;

    private String errorMessage;

    private Instant executedAt;

    private boolean dryRun;

    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    public static ActionResult succeeded(String message, Instant at) {
        return ActionResult.builder().success(true).message(message).executedAt(at).build();
    }

    public static ActionResult failed(String error, boolean critical, Instant at) {
        return ActionResult.builder().success(false).criticalFailure(critical).errorMessage(error)
                .executedAt(at).build();
    }
}
