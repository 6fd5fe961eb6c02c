package com.hivemind.core.analysis;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Substring matching over lower-cased text, with word-boundary matching for short tokens.
 */
final class KeywordMatcher {

    /**
     * Keywords that require word-boundary matching to avoid false positives
     * ("app" inside "approval", "rest" inside "interest", "and" inside "standard").
     */
    private static final Set<String> WORD_BOUNDARY_KEYWORDS = Set.of("app", "api", "rest", "acl", "and", "with");

    private KeywordMatcher() {}

    static boolean contains(String lowerText, String keyword) {
        if (WORD_BOUNDARY_KEYWORDS.contains(keyword)) {
            return Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b")
                    .matcher(lowerText).find();
        }
        return lowerText.contains(keyword);
    }

    static boolean containsAny(String lowerText, String... keywords) {
        for (String keyword : keywords) {
            if (contains(lowerText, keyword)) {
                return true;
            }
        }
        return false;
    }
}
