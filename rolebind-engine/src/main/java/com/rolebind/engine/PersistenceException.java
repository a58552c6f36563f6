package com.rolebind.engine;

/**
 * A binding store read or write failed. In-memory state is kept; the periodic
 * flush retries the write.
 */
public class PersistenceException extends RoleBindException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public PersistenceException(String message) {
        super(message);
    }
}
