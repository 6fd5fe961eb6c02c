package com.hivemind.core.model;

/**
 * How the planner decided agents should be spawned for an objective.
 */
public enum ExecutionStrategy {
    SEQUENTIAL,
    PARALLEL
}
