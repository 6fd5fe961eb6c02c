package com.hivemind.dispatch.api;

import java.util.List;
import java.util.Map;

/**
 * Request body for submitting an objective.
 *
 * @param id          optional caller-chosen id; generated when absent
 * @param description free-text objective (required)
 * @param priority    LOW, MEDIUM, HIGH or CRITICAL; MEDIUM when absent
 * @param constraints optional constraints, role tags among them extend the roster
 */
public record ObjectiveRequest(
        String id,
        String description,
        String priority,
        List<String> constraints,
        Map<String, Object> metadata
) {}
