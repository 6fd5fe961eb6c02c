package com.hivemind.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A free-text goal submitted for decomposition.
 */
public record Objective(
        String id,
        String description,
        Priority priority,
        Set<String> constraints,
        Map<String, Object> metadata
) implements Serializable {

    public Objective {
        priority = priority != null ? priority : Priority.MEDIUM;
        constraints = Collections.unmodifiableSet(constraints != null ? new LinkedHashSet<>(constraints) : new LinkedHashSet<>());
        metadata = Collections.unmodifiableMap(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
    }

    public static Objective of(String id, String description) {
        return new Objective(id, description, Priority.MEDIUM, Set.of(), Map.of());
    }

    public Objective withId(String newId) {
        return new Objective(newId, description, priority, constraints, metadata);
    }
}
