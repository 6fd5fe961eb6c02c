package com.hivemind.core.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Input to the decision engine.
 *
 * @param objectiveId  objective the decision belongs to, may be {@code null} for ad-hoc decisions
 * @param objective    free-text description of what the decision should serve
 * @param currentState arbitrary state; {@code failedAttempts} (a collection of options) is honoured
 * @param options      candidate options in preference order for tie-breaking
 */
public record DecisionRequest(
        String objectiveId,
        String objective,
        Map<String, Object> currentState,
        List<String> options
) {

    public DecisionRequest {
        currentState = currentState != null ? currentState : Map.of();
        options = options != null ? List.copyOf(options) : List.of();
    }

    public boolean previouslyFailed(String option) {
        Object failed = currentState.get("failedAttempts");
        return failed instanceof Collection<?> attempts && attempts.contains(option);
    }
}
