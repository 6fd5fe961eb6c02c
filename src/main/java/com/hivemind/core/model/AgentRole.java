package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Agent roles known to the coordinator.
 * <p>
 * Each role carries the capabilities it advertises and the assignment keywords the
 * capability matcher tests against task content (case-insensitive substring match).
 * Declaration order is the tie-break order whenever two roles match equally well.
 */
public enum AgentRole {

    RESEARCHER("researcher",
            List.of("requirement_analysis", "feasibility_study", "solution_research", "best_practice_identification"),
            List.of("analyze", "research", "requirements", "existing")),
    WIDGET_CREATOR("widget-creator",
            List.of("html_template", "css_styling", "client_script", "server_script"),
            List.of("widget", "template", "html", "html template", "server", "client", "deploy widget")),
    FLOW_BUILDER("flow-builder",
            List.of("flow_design", "trigger_configuration", "action_creation", "approval_routing"),
            List.of("flow", "trigger", "decision", "action", "workflow")),
    SCRIPT_WRITER("script-writer",
            List.of("business_rules", "script_includes", "client_scripts", "scheduled_jobs"),
            List.of("script", "business rule", "logic", "function")),
    APP_ARCHITECT("app-architect",
            List.of("system_design", "data_modeling", "security_architecture", "scalability_planning"),
            List.of("architecture", "design", "structure", "solution", "data model")),
    INTEGRATION_SPECIALIST("integration-specialist",
            List.of("rest_apis", "soap_services", "import_sets", "transform_maps"),
            List.of("integration", "rest", "soap", "api", "external", "endpoint")),
    CATALOG_MANAGER("catalog-manager",
            List.of("catalog_items", "variables", "ui_policies", "workflows"),
            List.of("catalog", "item", "category", "variable")),
    TESTER("tester",
            List.of("test_creation", "mock_data", "validation", "performance_testing"),
            List.of("test", "validate", "mock", "scenario", "integration test")),
    APPROVAL_SPECIALIST("approval-specialist",
            List.of("approval_rules", "approver_assignment", "escalation_paths"),
            List.of("approval", "approver", "escalation")),
    SECURITY_SPECIALIST("security-specialist",
            List.of("access_control_lists", "role_design", "permission_audit"),
            List.of("acl", "access", "role", "permission", "security")),
    CSS_SPECIALIST("css-specialist",
            List.of("responsive_layout", "theming", "accessibility_styling"),
            List.of("css", "style", "responsive", "theme")),
    BACKEND_SPECIALIST("backend-specialist",
            List.of("server_side_logic", "data_processing", "query_optimization"),
            List.of("server-side", "data processing", "backend", "tables")),
    FRONTEND_SPECIALIST("frontend-specialist",
            List.of("client_controllers", "ui_events", "data_binding"),
            List.of("client-side", "controller", "frontend"));

    private final String tag;
    private final List<String> capabilities;
    private final List<String> keywords;

    AgentRole(String tag, List<String> capabilities, List<String> keywords) {
        this.tag = tag;
        this.capabilities = capabilities;
        this.keywords = keywords;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public List<String> capabilities() {
        return capabilities;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Length of the longest assignment keyword contained in {@code content}, or 0 when none match.
     * Longer keywords are more specific ("server-side" beats "server").
     */
    public int matchSpecificity(String content) {
        if (content == null || content.isBlank()) {
            return 0;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        int best = 0;
        for (String keyword : keywords) {
            if (lower.contains(keyword) && keyword.length() > best) {
                best = keyword.length();
            }
        }
        return best;
    }

    public boolean matches(String content) {
        return matchSpecificity(content) > 0;
    }

    public static Optional<AgentRole> fromTag(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(r -> r.tag.equals(normalized) || r.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
