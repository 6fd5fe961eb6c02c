package com.hivemind.core.error;

public class ExecutionFailureException extends HivemindException {

    public ExecutionFailureException(String message) {
        super(message);
    }

    public ExecutionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
