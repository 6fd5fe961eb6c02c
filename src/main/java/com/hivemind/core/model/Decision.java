package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Write-once audit record of a choice made by the decision engine.
 */
public record Decision(
        String context,
        List<String> options,
        String chosenOption,
        double confidence,
        String reasoning,
        Instant timestamp
) implements Serializable {

    public Decision {
        options = List.copyOf(options);
    }
}
