package com.hivemind.core.model;

import java.io.Serializable;

/**
 * What kind of agent an {@link Agent} envelope carries. Roster agents come straight from
 * the objective analyzer; specialists are spawned by the planner for work the roster
 * does not cover.
 */
public sealed interface AgentProfile extends Serializable {

    AgentRole role();

    record Core(AgentRole role) implements AgentProfile {
    }

    record Specialist(AgentRole role, String specialization) implements AgentProfile {
    }
}
