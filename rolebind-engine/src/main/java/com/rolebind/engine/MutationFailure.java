package com.rolebind.engine;

import com.rolebind.engine.platform.MutationStatus;

/**
 * A platform call of an activation that did not succeed.
 *
 * @param roleId role concerned, null for {@link Operation#FETCH_MEMBER}
 */
public record MutationFailure(String roleId, Operation operation, MutationStatus status, String message) {

    public enum Operation {
        ADD,
        REMOVE,
        FETCH_MEMBER
    }
}
