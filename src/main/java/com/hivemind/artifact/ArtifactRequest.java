package com.hivemind.artifact;

import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.TaskType;

/**
 * What an agent asks the artifact backend to produce for one task.
 *
 * @param objective   free-text objective the task belongs to
 * @param taskContent the task being executed
 * @param taskType    objective classification, selects the target table
 * @param role        role of the executing agent
 */
public record ArtifactRequest(
        String objectiveId,
        String taskId,
        String objective,
        String taskContent,
        TaskType taskType,
        AgentRole role
) {

    public ArtifactRequest {
        taskType = taskType != null ? taskType : TaskType.GENERIC;
    }

    /** Platform table that stores artifacts for the given task type. */
    public String targetTable() {
        return switch (taskType) {
            case INTERACTIVE_COMPONENT -> "sp_widget";
            case PROCESS_AUTOMATION -> "sys_hub_flow";
            case SCRIPT -> "sys_script";
            case ACCESS_CONTROL -> "sys_security_acl";
            case APPLICATION -> "sys_app";
            case INTEGRATION -> "sys_rest_message";
            default -> "sys_script_include";
        };
    }
}
