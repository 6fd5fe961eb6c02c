package com.hivemind.dispatch.api;

/**
 * An execution error reported by an external executor.
 *
 * @param kind         {@code permission_denied} for platform refusals, anything else is a plain failure
 * @param resource     resource the operation targeted (permission errors)
 * @param artifactType kind of artifact being produced, shapes manual remediation actions
 */
public record ExecutionErrorRequest(
        String kind,
        String taskId,
        String agentId,
        String operation,
        String resource,
        String message,
        String artifactType
) {

    public boolean isPermissionDenied() {
        return "permission_denied".equalsIgnoreCase(kind);
    }
}
