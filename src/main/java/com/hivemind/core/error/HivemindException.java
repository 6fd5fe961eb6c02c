package com.hivemind.core.error;

/**
 * Root of the coordinator's unchecked exception hierarchy.
 */
public class HivemindException extends RuntimeException {

    public HivemindException(String message) {
        super(message);
    }

    public HivemindException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Walks the cause chain (graph execution wraps node failures) and returns the first
     * {@link HivemindException}, or {@code null} when there is none.
     */
    public static HivemindException find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof HivemindException he) {
                return he;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }
}
