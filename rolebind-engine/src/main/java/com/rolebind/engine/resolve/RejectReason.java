package com.rolebind.engine.resolve;

public enum RejectReason {
    /** The trigger has no usable binding. */
    MISSING_BINDING,
    /** The member holds none of the message's required roles. */
    MISSING_REQUIRED_ROLE,
    /** The member already holds the maximum number of roles of the message. */
    CAP_REACHED
}
