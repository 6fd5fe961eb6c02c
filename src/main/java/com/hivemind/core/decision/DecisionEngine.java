package com.hivemind.core.decision;

import com.hivemind.core.error.ValidationException;
import com.hivemind.core.memory.PatternStore;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Decision;
import com.hivemind.core.model.DecisionRequest;
import com.hivemind.core.model.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chooses among candidate options using pattern history, keyword alignment with the
 * objective and a penalty for options that already failed.
 * <p>
 * Score per option: base 50, plus {@code successRate * 20} for every similar pattern whose
 * agent sequence appears in the option, plus 5 per word shared with the objective, minus 30
 * when listed in {@code failedAttempts}; clipped to {@code [0, 100]}. The first option wins
 * ties. Every decision is written to the pattern store.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double BASE_SCORE = 50;
    static final double PATTERN_WEIGHT = 20;
    static final double WORD_BONUS = 5;
    static final double FAILURE_PENALTY = 30;
    static final double MAX_CONFIDENCE = 0.95;

    private final PatternStore patternStore;
    private final Clock clock;

    @Autowired
    public DecisionEngine(PatternStore patternStore) {
        this(patternStore, Clock.systemUTC());
    }

    DecisionEngine(PatternStore patternStore, Clock clock) {
        this.patternStore = patternStore;
        this.clock = clock;
    }

    public Decision decide(DecisionRequest request) {
        if (request.options().isEmpty()) {
            throw new ValidationException("A decision needs at least one option");
        }
        String objective = request.objective() != null ? request.objective() : "";
        List<Pattern> similar = patternStore.findSimilarPatterns(objective);
        Set<String> objectiveWords = words(objective);

        OptionScore best = null;
        for (String option : request.options()) {
            OptionScore scored = score(option, similar, objectiveWords, request.previouslyFailed(option));
            log.debug("Option '{}' scored {}", option, scored.score());
            if (best == null || scored.score() > best.score()) {
                best = scored;
            }
        }

        double confidence = Math.min(MAX_CONFIDENCE, best.score() / 100.0);
        Decision decision = new Decision(objective, request.options(), best.option(), confidence,
                best.reasoning(), clock.instant());
        patternStore.storeDecision(decision);
        log.info("Decision for '{}': {} (confidence {})", objective, decision.chosenOption(),
                "%.2f".formatted(confidence));
        return decision;
    }

    private record OptionScore(String option, double score, String reasoning) {}

    private OptionScore score(String option, List<Pattern> similar, Set<String> objectiveWords, boolean failedBefore) {
        double score = BASE_SCORE;
        var reasons = new ArrayList<String>();

        List<Pattern> matching = similar.stream().filter(p -> overlaps(option, p)).toList();
        if (!matching.isEmpty()) {
            double rateSum = 0;
            for (Pattern pattern : matching) {
                score += pattern.successRate() * PATTERN_WEIGHT;
                rateSum += pattern.successRate();
            }
            long percent = Math.round(rateSum / matching.size() * 100);
            reasons.add("Historical success rate: " + percent + "%");
        }

        Set<String> optionWords = words(option);
        long shared = optionWords.stream().filter(objectiveWords::contains).count();
        if (shared > 0) {
            score += shared * WORD_BONUS;
            reasons.add("Aligns with objective keywords (" + shared + " shared)");
        }

        if (failedBefore) {
            score -= FAILURE_PENALTY;
            reasons.add("Previously failed, penalty applied");
        }

        score = Math.max(0, Math.min(100, score));
        String reasoning = reasons.isEmpty() ? "Selected as best available option" : String.join("; ", reasons);
        return new OptionScore(option, score, reasoning);
    }

    /**
     * An option overlaps a pattern when it names one of the pattern's roles, comparing
     * underscores and hyphens alike ("spawn_widget_creator" names widget-creator).
     */
    static boolean overlaps(String option, Pattern pattern) {
        String normalized = option.toLowerCase(Locale.ROOT).replace('_', '-');
        for (AgentRole role : pattern.agentSequence()) {
            if (normalized.contains(role.tag())) {
                return true;
            }
        }
        return false;
    }

    static Set<String> words(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> w.length() >= 3)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
