package com.hivemind.core.model;

/**
 * Priority carried by objectives and the tasks derived from them.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
