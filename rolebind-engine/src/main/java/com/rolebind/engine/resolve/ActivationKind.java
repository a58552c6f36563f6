package com.rolebind.engine.resolve;

/**
 * Direction of a trigger activation. Buttons always SELECT (the resolver
 * toggles); removing a reaction is a DESELECT.
 */
public enum ActivationKind {
    SELECT,
    DESELECT
}
