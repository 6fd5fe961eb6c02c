package com.hivemind.core.error;

/**
 * An internal coordinator invariant broke. Logged to the pattern store and re-thrown.
 */
public class CoordinationException extends HivemindException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
