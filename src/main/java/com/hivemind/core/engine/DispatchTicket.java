package com.hivemind.core.engine;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Task;

/**
 * A ready task together with the agent that will execute it in the current wave.
 */
public record DispatchTicket(String objectiveId, int waveNumber, Task task, Agent agent) {
}
