package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A logical worker spawned for one objective.
 */
public record Agent(
        String id,
        String objectiveId,
        AgentStatus status,
        Instant startTime,
        AgentProfile profile
) implements Serializable {

    public AgentRole role() {
        return profile.role();
    }

    public List<String> capabilities() {
        return profile.role().capabilities();
    }

    public boolean isSpecialist() {
        return profile instanceof AgentProfile.Specialist;
    }

    public Agent withStatus(AgentStatus newStatus) {
        return new Agent(id, objectiveId, newStatus, startTime, profile);
    }
}
