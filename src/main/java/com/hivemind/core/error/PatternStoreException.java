package com.hivemind.core.error;

public class PatternStoreException extends HivemindException {

    public PatternStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
