package com.hivemind.artifact;

import com.hivemind.core.error.ArtifactGenerationException;

/**
 * Backend that turns a task into a concrete platform artifact.
 */
public interface ArtifactGenerator {

    /**
     * @throws ArtifactGenerationException with kind {@code BACKEND_UNAVAILABLE} when the backend
     *                                     cannot be reached, {@code CONTENT_PARSE} when its answer is unusable
     */
    GeneratedArtifact generate(ArtifactRequest request);
}
