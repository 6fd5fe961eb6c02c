package com.hivemind.core.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.PatternStoreStats;
import com.hivemind.core.model.TaskHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed {@link PatternStore}. Used when no database is configured; contents are lost
 * on restart.
 */
public class InMemoryPatternStore implements PatternStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPatternStore.class);

    private final ObjectMapper objectMapper;
    private final int historyLimit;
    private final int similarLimit;

    private final ConcurrentHashMap<String, JsonNode> entries = new ConcurrentHashMap<>();
    private final Map<String, Pattern> latestByType = new LinkedHashMap<>();
    private final Deque<TaskHistoryEntry> history = new ArrayDeque<>();
    private final AtomicLong decisionSequence = new AtomicLong();

    public InMemoryPatternStore(ObjectMapper objectMapper, int historyLimit, int similarLimit) {
        this.objectMapper = objectMapper;
        this.historyLimit = historyLimit;
        this.similarLimit = similarLimit;
    }

    @Override
    public void store(String key, Object value) {
        entries.put(key, objectMapper.valueToTree(value));
        log.debug("Stored memory entry '{}'", key);
    }

    @Override
    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Keeps only the latest pattern per task type; its use count covers every stored one. */
    @Override
    public synchronized void storePattern(Pattern pattern) {
        Pattern previous = latestByType.get(pattern.taskType());
        int uses = previous != null ? previous.useCount() + 1 : 1;
        latestByType.put(pattern.taskType(), new Pattern(pattern.taskType(), pattern.agentSequence(),
                pattern.successRate(), pattern.avgDurationMs(), pattern.lastUsed(), uses));
    }

    @Override
    public synchronized Optional<Pattern> findBestPattern(String taskType) {
        return Optional.ofNullable(latestByType.get(taskType));
    }

    @Override
    public synchronized List<Pattern> findSimilarPatterns(String text) {
        return PatternMatching.rankSimilar(List.copyOf(latestByType.values()), text, similarLimit);
    }

    @Override
    public void storeDecision(Decision decision) {
        store("decision_" + decision.timestamp().toEpochMilli() + "_" + decisionSequence.incrementAndGet(), decision);
    }

    @Override
    public synchronized void recordTaskCompletion(TaskHistoryEntry entry) {
        history.addLast(entry);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    @Override
    public synchronized double successRate(String taskType) {
        long total = 0;
        long succeeded = 0;
        for (TaskHistoryEntry entry : history) {
            if (entry.taskType().equals(taskType)) {
                total++;
                if (entry.success()) {
                    succeeded++;
                }
            }
        }
        return total == 0 ? PatternMatching.DEFAULT_SUCCESS_RATE : (double) succeeded / total;
    }

    @Override
    public synchronized PatternStoreStats stats() {
        long succeeded = history.stream().filter(TaskHistoryEntry::success).count();
        double overall = history.isEmpty() ? 0.0 : (double) succeeded / history.size();
        return new PatternStoreStats(entries.size(), latestByType.size(), history.size(), overall);
    }
}
