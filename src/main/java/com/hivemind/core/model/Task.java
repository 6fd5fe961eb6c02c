package com.hivemind.core.model;

import com.hivemind.core.error.InvalidTransitionException;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;

/**
 * One unit of work inside a task graph. Immutable: every status change produces a new
 * record that the coordinator writes back into the graph.
 */
public record Task(
        String id,
        String content,
        TaskStatus status,
        Priority priority,
        Instant startedAt,
        Instant completedAt,
        String failureReason
) implements Serializable {

    public static Task pending(String id, String content, Priority priority) {
        return new Task(id, content, TaskStatus.PENDING, priority, null, null, null);
    }

    public Task start(Instant now) {
        requireStatus(TaskStatus.IN_PROGRESS, TaskStatus.PENDING);
        return new Task(id, content, TaskStatus.IN_PROGRESS, priority, now, null, null);
    }

    public Task complete(Instant now) {
        requireStatus(TaskStatus.COMPLETED, TaskStatus.IN_PROGRESS);
        return new Task(id, content, TaskStatus.COMPLETED, priority, startedAt, now, null);
    }

    public Task fail(Instant now, String reason) {
        requireStatus(TaskStatus.FAILED, TaskStatus.IN_PROGRESS);
        return new Task(id, content, TaskStatus.FAILED, priority, startedAt, now, reason);
    }

    public Task cancel(Instant now) {
        if (status.isTerminal()) {
            throw new InvalidTransitionException(id, status, TaskStatus.CANCELLED);
        }
        return new Task(id, content, TaskStatus.CANCELLED, priority, startedAt, now, "objective cancelled");
    }

    public boolean mentions(String keyword) {
        return content != null && content.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }

    private void requireStatus(TaskStatus target, TaskStatus expected) {
        if (status != expected) {
            throw new InvalidTransitionException(id, status, target);
        }
    }
}
