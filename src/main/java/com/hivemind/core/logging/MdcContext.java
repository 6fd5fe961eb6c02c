package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setObjective(String objectiveId) {
        MDC.put("objectiveId", objectiveId);
    }

    public static void setTask(String objectiveId, String taskId, String agentRole) {
        MDC.put("objectiveId", objectiveId);
        MDC.put("taskId", taskId);
        if (agentRole != null) {
            MDC.put("agentRole", agentRole);
        }
    }

    public static void setWave(String objectiveId, int waveNumber) {
        MDC.put("objectiveId", objectiveId);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void clear() {
        MDC.remove("objectiveId");
        MDC.remove("taskId");
        MDC.remove("agentRole");
        MDC.remove("waveNumber");
    }
}
