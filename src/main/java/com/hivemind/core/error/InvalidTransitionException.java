package com.hivemind.core.error;

/**
 * A status change the task or objective lifecycle does not allow.
 */
public class InvalidTransitionException extends HivemindException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    public InvalidTransitionException(String subjectId, Enum<?> from, Enum<?> to) {
        super("Cannot move " + subjectId + " from " + from + " to " + to);
    }
}
