package com.hivemind.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle event published by the coordinator.
 *
 * @param eventType   dotted event name, e.g. {@code objective.analyzed}
 * @param objectiveId owning objective, {@code null} for coordinator-wide events
 * @param taskId      related task, may be {@code null}
 * @param payload     event-specific data
 * @param timestamp   when the event was created
 */
public record HivemindEvent(
        String eventType,
        String objectiveId,
        String taskId,
        Map<String, Object> payload,
        Instant timestamp
) {

    public HivemindEvent {
        payload = payload != null ? payload : Map.of();
    }

    public static HivemindEvent of(String eventType, String objectiveId, Map<String, Object> payload) {
        return new HivemindEvent(eventType, objectiveId, null, payload, Instant.now());
    }

    public static HivemindEvent forTask(String eventType, String objectiveId, String taskId, Map<String, Object> payload) {
        return new HivemindEvent(eventType, objectiveId, taskId, payload, Instant.now());
    }
}
