package com.rolebind.engine;

/**
 * An invalid configuration request (duplicate role, unknown message or
 * trigger, style mismatch). Raised before any platform call.
 */
public class ConfigurationException extends RoleBindException {

    public ConfigurationException(String message) {
        super(message);
    }
}
