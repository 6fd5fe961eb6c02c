package com.hivemind.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically fails tasks that stopped reporting progress.
 */
@Component
public class StaleTaskSweeper {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskSweeper.class);

    private final QueenCoordinator coordinator;

    public StaleTaskSweeper(QueenCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Scheduled(fixedDelayString = "${hivemind.coordinator.sweep-interval-ms:60000}",
            initialDelayString = "${hivemind.coordinator.sweep-interval-ms:60000}")
    public void sweep() {
        int reaped = coordinator.reapAllStaleTasks();
        if (reaped > 0) {
            log.warn("Stale task sweep failed {} tasks", reaped);
        }
    }
}
