package com.hivemind.core.model;

/**
 * Lifecycle of a single task inside a {@link com.hivemind.core.planning.TaskGraph}.
 * <p>
 * Allowed transitions: {@code PENDING -> IN_PROGRESS -> COMPLETED | FAILED}, plus
 * {@code CANCELLED} from any non-terminal state when the owning objective is cancelled.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
