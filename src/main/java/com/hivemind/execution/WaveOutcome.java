package com.hivemind.execution;

/**
 * Result of executing one wave of ready tasks.
 *
 * @param dispatched tasks started in the wave
 * @param completed  tasks reported completed
 * @param failed     tasks whose error was not remediated automatically
 * @param remediated tasks that failed with a permission error and got an automatic retry
 */
public record WaveOutcome(
        String objectiveId,
        int waveNumber,
        int dispatched,
        int completed,
        int failed,
        int remediated,
        long durationMs
) {

    public static WaveOutcome empty(String objectiveId) {
        return new WaveOutcome(objectiveId, 0, 0, 0, 0, 0, 0);
    }

    public boolean isEmpty() {
        return dispatched == 0;
    }
}
