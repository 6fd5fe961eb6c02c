package com.hivemind.core.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.TaskHistoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPatternStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryPatternStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryPatternStore(new ObjectMapper().findAndRegisterModules(), 3, 5);
    }

    private static Pattern pattern(String type, double rate) {
        return new Pattern(type, List.of(AgentRole.RESEARCHER), rate, 1_000, NOW, 1);
    }

    private static TaskHistoryEntry history(String type, boolean success) {
        return new TaskHistoryEntry("OBJ-1", "objective", type, List.of(AgentRole.RESEARCHER), success, 10, NOW);
    }

    @Nested
    @DisplayName("key-value entries")
    class Entries {

        @Test
        @DisplayName("stores values as JSON and replaces on rewrite")
        void storeAndGet() {
            store.store("progress_OBJ-1", Map.of("overall", 25.0));
            store.store("progress_OBJ-1", Map.of("overall", 50.0));

            assertEquals(50.0, store.get("progress_OBJ-1").orElseThrow().get("overall").asDouble());
            assertTrue(store.get("missing").isEmpty());
            assertEquals(1, store.stats().storedEntries());
        }

        @Test
        @DisplayName("decisions get unique keys")
        void decisionsStoredSeparately() {
            var decision = new Decision("ctx", List.of("a", "b"), "a", 0.6, "reason", NOW);
            store.storeDecision(decision);
            store.storeDecision(decision);

            assertEquals(2, store.stats().storedEntries());
        }
    }

    @Nested
    @DisplayName("patterns")
    class Patterns {

        @Test
        @DisplayName("latest observation wins and use count accumulates")
        void appendOnly() {
            store.storePattern(pattern("script", 0.4));
            store.storePattern(pattern("script", 0.8));

            Pattern best = store.findBestPattern("script").orElseThrow();
            assertEquals(0.8, best.successRate());
            assertEquals(2, best.useCount());
            assertEquals(1, store.stats().patternCount());
        }

        @Test
        @DisplayName("repeated observations keep one pattern per task type")
        void repeatedObservationsStayBounded() {
            for (int i = 1; i <= 500; i++) {
                store.storePattern(pattern(i % 2 == 0 ? "script" : "integration", i / 1000.0));
            }

            assertEquals(2, store.stats().patternCount());
            Pattern script = store.findBestPattern("script").orElseThrow();
            assertEquals(250, script.useCount());
            assertEquals(0.5, script.successRate());
            assertEquals(250, store.findBestPattern("integration").orElseThrow().useCount());
        }

        @Test
        @DisplayName("similar patterns are ranked by success rate")
        void similarRanked() {
            store.storePattern(pattern("interactive-component", 0.6));
            store.storePattern(pattern("process-automation", 0.9));
            store.storePattern(pattern("integration", 0.95));

            List<Pattern> similar = store.findSimilarPatterns("an interactive approval process");

            assertEquals(List.of("process-automation", "interactive-component"),
                    similar.stream().map(Pattern::taskType).toList());
        }

        @Test
        @DisplayName("blank text matches nothing")
        void blankMatchesNothing() {
            store.storePattern(pattern("script", 0.5));
            assertTrue(store.findSimilarPatterns(" ").isEmpty());
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("success rate defaults to one half")
        void defaultRate() {
            assertEquals(0.5, store.successRate("script"));
        }

        @Test
        @DisplayName("success rate uses only the most recent entries")
        void boundedHistory() {
            store.recordTaskCompletion(history("script", false));
            store.recordTaskCompletion(history("script", true));
            store.recordTaskCompletion(history("script", true));
            store.recordTaskCompletion(history("script", true));

            assertEquals(1.0, store.successRate("script"));
            assertEquals(3, store.stats().historyCount());
            assertEquals(1.0, store.stats().overallSuccessRate());
        }
    }
}
