package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of objective categories produced by the objective analyzer.
 * Each type owns a task template and a capability roster.
 */
public enum TaskType {
    INTERACTIVE_COMPONENT("interactive-component"),
    PROCESS_AUTOMATION("process-automation"),
    SCRIPT("script"),
    APPLICATION("application"),
    INTEGRATION("integration"),
    ACCESS_CONTROL("access-control"),
    GENERIC("generic");

    private final String tag;

    TaskType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Resolves a tag or enum name, case-insensitively. Unknown values map to {@link #GENERIC}.
     */
    public static TaskType fromTag(String value) {
        if (value == null) {
            return GENERIC;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(t -> t.tag.equals(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(GENERIC);
    }
}
