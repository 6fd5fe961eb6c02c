package com.hivemind.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.PatternStoreStats;
import com.hivemind.core.model.TaskHistoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistent memory shared by all objectives: a key-value area for analyses, agent
 * rosters, progress snapshots and decisions, plus append-only pattern and task history.
 * <p>
 * Implementations must be safe for concurrent use; writes are put/append only.
 */
public interface PatternStore {

    /** Stores {@code value} as JSON under {@code key}, replacing any previous value. */
    void store(String key, Object value);

    Optional<JsonNode> get(String key);

    /**
     * Appends a pattern observation. Queries see the latest observation per task type
     * with {@link Pattern#useCount()} equal to the number of observations.
     */
    void storePattern(Pattern pattern);

    Optional<Pattern> findBestPattern(String taskType);

    /**
     * Patterns related to {@code text}, best success rate first, then most used.
     */
    List<Pattern> findSimilarPatterns(String text);

    void storeDecision(Decision decision);

    void recordTaskCompletion(TaskHistoryEntry entry);

    /**
     * Success rate of recent history for the task type, {@value PatternMatching#DEFAULT_SUCCESS_RATE}
     * when there is none.
     */
    double successRate(String taskType);

    PatternStoreStats stats();
}
