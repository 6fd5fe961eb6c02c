package com.hivemind.core.analysis;

import com.hivemind.core.memory.PatternStore;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.Objective;
import com.hivemind.core.model.Pattern;
import com.hivemind.core.model.TaskAnalysis;
import com.hivemind.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies an objective into a {@link TaskType}, derives the capability roster,
 * estimates complexity and detects domain dependencies.
 * <p>
 * Classification walks an ordered keyword table over the lower-cased description; the
 * first type with a matching keyword wins and anything unmatched is {@link TaskType#GENERIC}.
 * Analysis never fails on content: blank descriptions are rejected before they get here.
 */
@Service
public class ObjectiveAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveAnalyzer.class);

    private record TypeRule(TaskType type, List<String> keywords) {}

    private record DependencyRule(String keyword, String dependency) {}

    /** Evaluated top to bottom, first match wins. */
    private static final List<TypeRule> TYPE_RULES = List.of(
            new TypeRule(TaskType.INTERACTIVE_COMPONENT,
                    List.of("widget", "portal", "dashboard", "ui component", "chart")),
            new TypeRule(TaskType.PROCESS_AUTOMATION,
                    List.of("workflow", "flow", "approval", "automation")),
            new TypeRule(TaskType.ACCESS_CONTROL,
                    List.of("acl", "access control", "permission", "security rule", "role-based")),
            new TypeRule(TaskType.SCRIPT,
                    List.of("script", "business rule")),
            new TypeRule(TaskType.APPLICATION,
                    List.of("application", "app")),
            new TypeRule(TaskType.INTEGRATION,
                    List.of("integration", "api", "rest", "soap", "endpoint", "webhook"))
    );

    private static final List<DependencyRule> DEPENDENCY_RULES = List.of(
            new DependencyRule("table", "table_creation"),
            new DependencyRule("user", "user_management"),
            new DependencyRule("approval", "approval_framework"),
            new DependencyRule("notification", "notification_system")
    );

    private final PatternStore patternStore;

    public ObjectiveAnalyzer(PatternStore patternStore) {
        this.patternStore = patternStore;
    }

    public TaskAnalysis analyze(Objective objective) {
        String description = objective.description() == null ? "" : objective.description();
        String lower = description.toLowerCase(Locale.ROOT);

        TaskType type = classify(lower);
        List<AgentRole> roster = roster(type, lower, objective.constraints());
        int complexity = estimateComplexity(lower);
        List<String> dependencies = detectDependencies(lower);
        Pattern suggested = patternStore.findBestPattern(type.tag()).orElse(null);

        log.info("Objective {} classified as {} (complexity {}, roster {})",
                objective.id(), type.tag(), complexity, roster.stream().map(AgentRole::tag).toList());
        return new TaskAnalysis(type, roster, complexity, dependencies, suggested);
    }

    TaskType classify(String lowerDescription) {
        for (TypeRule rule : TYPE_RULES) {
            for (String keyword : rule.keywords()) {
                if (KeywordMatcher.contains(lowerDescription, keyword)) {
                    return rule.type();
                }
            }
        }
        return TaskType.GENERIC;
    }

    List<AgentRole> roster(TaskType type, String lowerDescription, Set<String> constraints) {
        boolean mentionsTests = lowerDescription.contains("test");
        var roles = new LinkedHashSet<AgentRole>();
        roles.add(AgentRole.RESEARCHER);

        switch (type) {
            case INTERACTIVE_COMPONENT -> {
                roles.add(AgentRole.WIDGET_CREATOR);
                if (mentionsTests) roles.add(AgentRole.TESTER);
            }
            case PROCESS_AUTOMATION -> {
                roles.add(AgentRole.FLOW_BUILDER);
                if (lowerDescription.contains("approval")) roles.add(AgentRole.APPROVAL_SPECIALIST);
                if (lowerDescription.contains("catalog")) roles.add(AgentRole.CATALOG_MANAGER);
                if (mentionsTests) roles.add(AgentRole.TESTER);
            }
            case SCRIPT -> {
                roles.add(AgentRole.SCRIPT_WRITER);
                if (mentionsTests) roles.add(AgentRole.TESTER);
            }
            case INTEGRATION -> {
                roles.add(AgentRole.INTEGRATION_SPECIALIST);
                roles.add(AgentRole.TESTER);
            }
            case APPLICATION -> {
                roles.add(AgentRole.APP_ARCHITECT);
                roles.add(AgentRole.WIDGET_CREATOR);
                roles.add(AgentRole.FLOW_BUILDER);
                roles.add(AgentRole.TESTER);
            }
            case ACCESS_CONTROL -> {
                roles.add(AgentRole.SECURITY_SPECIALIST);
                roles.add(AgentRole.TESTER);
            }
            case GENERIC -> {
                roles.add(AgentRole.APP_ARCHITECT);
                roles.add(AgentRole.SCRIPT_WRITER);
            }
        }

        // Constraints may name extra roles explicitly, e.g. "tester"
        for (String constraint : constraints) {
            AgentRole.fromTag(constraint).ifPresent(roles::add);
        }
        return new ArrayList<>(roles);
    }

    /**
     * Word count over ten plus weighted indicator terms, rounded and clipped to {@code [1, 10]}.
     */
    int estimateComplexity(String lowerDescription) {
        String trimmed = lowerDescription.trim();
        double score = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length / 10.0;

        if (KeywordMatcher.containsAny(lowerDescription, "integration", "api")) score += 2;
        if (KeywordMatcher.containsAny(lowerDescription, "and", "with")) score += 1;
        if (KeywordMatcher.containsAny(lowerDescription, "complex", "advanced")) score += 2;
        if (KeywordMatcher.containsAny(lowerDescription, "performance", "optimize")) score += 1;
        if (KeywordMatcher.containsAny(lowerDescription, "approval")) score += 1;

        return (int) Math.max(1, Math.min(10, Math.round(score)));
    }

    List<String> detectDependencies(String lowerDescription) {
        var dependencies = new ArrayList<String>();
        for (DependencyRule rule : DEPENDENCY_RULES) {
            if (lowerDescription.contains(rule.keyword())) {
                dependencies.add(rule.dependency());
            }
        }
        return dependencies;
    }
}
