package com.hivemind.core.model;

/**
 * Where an execution error happened. Only {@code objectiveId} is required.
 */
public record ExecutionErrorContext(
        String objectiveId,
        String agentId,
        String taskId,
        String operation,
        String artifactType
) {

    public static ExecutionErrorContext forTask(String objectiveId, String taskId, String operation) {
        return new ExecutionErrorContext(objectiveId, null, taskId, operation, null);
    }
}
