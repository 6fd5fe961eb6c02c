package com.hivemind.core.error;

/**
 * The artifact generation backend failed to produce a usable artifact.
 */
public class ArtifactGenerationException extends HivemindException {

    public enum Kind {
        /** The backend answered but the content could not be parsed. */
        CONTENT_PARSE,
        /** The backend could not be reached or returned nothing. */
        BACKEND_UNAVAILABLE
    }

    private final Kind kind;
    private final String rawResponse;

    public ArtifactGenerationException(Kind kind, String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.rawResponse = rawResponse;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
