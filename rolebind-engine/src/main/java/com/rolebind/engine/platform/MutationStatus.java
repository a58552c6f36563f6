package com.rolebind.engine.platform;

/**
 * Result of a single platform role mutation.
 */
public enum MutationStatus {
    OK,
    /** Missing permission or role hierarchy violation. */
    FORBIDDEN,
    /** Role or member does not exist. */
    NOT_FOUND,
    /** Any other failure (network, unexpected response). */
    FAILED;

    public boolean ok() {
        return this == OK;
    }
}
