package com.hivemind.core.error;

/**
 * The platform refused an operation on a resource (HTTP 401/403 or an explicit ACL denial).
 */
public class PermissionDeniedException extends HivemindException {

    private final String operation;
    private final String resource;

    public PermissionDeniedException(String operation, String resource, String message) {
        super(message);
        this.operation = operation;
        this.resource = resource;
    }

    public PermissionDeniedException(String operation, String resource, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.resource = resource;
    }

    public String getOperation() {
        return operation;
    }

    public String getResource() {
        return resource;
    }

    /** Key used to remember that this operation/resource pair was already remediated. */
    public String remediationKey() {
        return operation + ":" + resource;
    }
}
