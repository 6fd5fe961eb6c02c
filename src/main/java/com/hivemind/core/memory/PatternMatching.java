package com.hivemind.core.memory;

import com.hivemind.core.model.Pattern;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Similarity rules shared by the pattern store implementations.
 */
final class PatternMatching {

    static final double DEFAULT_SUCCESS_RATE = 0.5;

    private static final int MIN_TOKEN_LENGTH = 3;

    private PatternMatching() {}

    /**
     * A pattern relates to {@code text} when either contains the other, or when they share
     * a word of at least three letters ("interactive-component" relates to "component").
     */
    static boolean isSimilar(String taskType, String text) {
        if (taskType == null || text == null || text.isBlank()) {
            return false;
        }
        String type = taskType.toLowerCase(Locale.ROOT);
        String query = text.toLowerCase(Locale.ROOT).trim();
        if (type.contains(query) || query.contains(type)) {
            return true;
        }
        Set<String> queryTokens = tokens(query);
        return tokens(type).stream().anyMatch(queryTokens::contains);
    }

    static List<Pattern> rankSimilar(Collection<Pattern> patterns, String text, int limit) {
        return patterns.stream()
                .filter(p -> isSimilar(p.taskType(), text))
                .sorted(Comparator.comparingDouble(Pattern::successRate).reversed()
                        .thenComparing(Comparator.comparingInt(Pattern::useCount).reversed()))
                .limit(limit)
                .toList();
    }

    static Set<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> t.length() >= MIN_TOKEN_LENGTH)
                .collect(Collectors.toSet());
    }
}
