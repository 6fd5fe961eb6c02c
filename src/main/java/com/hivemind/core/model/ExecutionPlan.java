package com.hivemind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Planner output. Derived on every spawn request and never persisted.
 *
 * @param strategy          sequential or parallel spawning
 * @param waves             simulated waves in execution order
 * @param rolesToSpawn      roles that need a new agent, already trimmed to free capacity
 * @param unplannedTaskIds  tasks no role matches, or that can never become ready
 */
public record ExecutionPlan(
        ExecutionStrategy strategy,
        List<Wave> waves,
        List<AgentRole> rolesToSpawn,
        List<String> unplannedTaskIds
) implements Serializable {

    public ExecutionPlan {
        waves = List.copyOf(waves);
        rolesToSpawn = List.copyOf(rolesToSpawn);
        unplannedTaskIds = List.copyOf(unplannedTaskIds);
    }

    public boolean isParallel() {
        return strategy == ExecutionStrategy.PARALLEL;
    }

    public record Wave(int number, List<RoleAssignment> assignments) implements Serializable {

        public Wave {
            assignments = List.copyOf(assignments);
        }

        public List<AgentRole> roles() {
            return assignments.stream().map(RoleAssignment::role).toList();
        }
    }

    public record RoleAssignment(AgentRole role, List<String> taskIds) implements Serializable {

        public RoleAssignment {
            taskIds = List.copyOf(taskIds);
        }
    }
}
