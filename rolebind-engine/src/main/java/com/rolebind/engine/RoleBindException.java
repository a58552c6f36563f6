package com.rolebind.engine;

/**
 * Base type of every error raised by the role assignment engine.
 */
public class RoleBindException extends RuntimeException {

    public RoleBindException(String message) {
        super(message);
    }

    public RoleBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
