package com.hivemind.core.error;

/**
 * Malformed input: blank objective, empty decision options, or an invalid task graph.
 */
public class ValidationException extends HivemindException {

    public ValidationException(String message) {
        super(message);
    }
}
