package com.hivemind.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an objective owned by the coordinator.
 */
public enum ObjectiveStatus {
    SUBMITTED,
    ANALYZED,
    GRAPH_BUILT,
    SPAWNING,
    MONITORING,
    COMPLETED,
    STALLED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Whether the lifecycle permits moving from this state to {@code next}.
     * Re-entering {@code SPAWNING} is allowed from {@code MONITORING} and {@code STALLED}.
     */
    public boolean canTransitionTo(ObjectiveStatus next) {
        if (this == next) {
            return this == SPAWNING || this == MONITORING || this == STALLED;
        }
        if (next == CANCELLED) {
            return !isTerminal();
        }
        return allowedNext().contains(next);
    }

    private Set<ObjectiveStatus> allowedNext() {
        return switch (this) {
            case SUBMITTED -> EnumSet.of(ANALYZED);
            case ANALYZED -> EnumSet.of(GRAPH_BUILT);
            case GRAPH_BUILT -> EnumSet.of(SPAWNING, COMPLETED);
            case SPAWNING -> EnumSet.of(MONITORING, COMPLETED);
            case MONITORING -> EnumSet.of(COMPLETED, STALLED, SPAWNING);
            case STALLED -> EnumSet.of(SPAWNING, MONITORING, COMPLETED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(ObjectiveStatus.class);
        };
    }
}
