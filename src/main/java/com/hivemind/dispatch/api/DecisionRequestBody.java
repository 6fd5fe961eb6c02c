package com.hivemind.dispatch.api;

import java.util.List;
import java.util.Map;

public record DecisionRequestBody(
        String objectiveId,
        String objective,
        Map<String, Object> currentState,
        List<String> options
) {}
