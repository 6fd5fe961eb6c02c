package com.hivemind.core.model;

public enum AgentStatus {
    IDLE,
    ACTIVE,
    BLOCKED,
    COMPLETED,
    FAILED;

    /** Live agents count against the objective's concurrency cap. */
    public boolean isLive() {
        return this == IDLE || this == ACTIVE || this == BLOCKED;
    }
}
