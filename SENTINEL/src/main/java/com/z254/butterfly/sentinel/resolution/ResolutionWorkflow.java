package com.z254.butterfly.sentinel.resolution;

import com.z254.butterfly.sentinel.domain.model.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One resolution attempt for one incident, owned by the executor while it runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionWorkflow {

    private String id;

    private String incidentId;

    private String serviceName;

    @Builder.Default
    private List<ActionType> actions = new ArrayList<>();

    private volatile int currentStep;

    private double successProbability;

    @Builder.Default
    private List<String> rollbackActions = new ArrayList<>();

    @Builder.Default
    private List<ExecutionLogEntry> executionLog = new CopyOnWriteArrayList<>();

    private Instant startedAt;

    private Instant completedAt;

    public void log(ExecutionLogEntry entry) {
        executionLog.add(entry);
    }

    public List<ExecutionLogEntry> entries(ExecutionLogEntry.EntryKind kind) {
        return executionLog.stream().filter(entry -> entry.getKind() == kind).toList();
    }
}
