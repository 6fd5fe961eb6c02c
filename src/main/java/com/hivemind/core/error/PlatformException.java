package com.hivemind.core.error;

public class PlatformException extends HivemindException {

    private final int statusCode;

    public PlatformException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the platform, or -1 when the call never completed. */
    public int getStatusCode() {
        return statusCode;
    }
}
