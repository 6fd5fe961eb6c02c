package com.hivemind.core.model;

public record PatternStoreStats(
        int storedEntries,
        int patternCount,
        int historyCount,
        double overallSuccessRate
) {
}
