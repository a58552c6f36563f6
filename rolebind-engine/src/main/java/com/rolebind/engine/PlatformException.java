package com.rolebind.engine;

import com.rolebind.engine.platform.MutationStatus;

/**
 * A platform call failed: permission denied, hierarchy violation, or the
 * referenced role, member or message does not exist.
 */
public class PlatformException extends RoleBindException {

    private final MutationStatus status;

    public PlatformException(String message, MutationStatus status) {
        super(message);
        this.status = status;
    }

    public PlatformException(String message, MutationStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public MutationStatus getStatus() {
        return status;
    }
}
