package com.hivemind.artifact;

import java.util.Map;

/**
 * A generated platform artifact, ready to be written as a record into {@code table}.
 */
public record GeneratedArtifact(
        String table,
        String name,
        Map<String, String> fields,
        String summary
) {

    public GeneratedArtifact {
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }
}
