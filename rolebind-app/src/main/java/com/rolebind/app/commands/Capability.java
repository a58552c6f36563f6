package com.rolebind.app.commands;

/**
 * Guild permissions relevant to role message administration.
 */
public enum Capability {
    MANAGE_ROLES,
    ADMINISTRATOR
}
