package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Activation gates of a role message.
 *
 * @param requiredRoles the member must hold at least one of these; empty means
 *                      no gate
 * @param maxRoles      cap on simultaneously held roles of the message,
 *                      nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Settings(Set<String> requiredRoles, Integer maxRoles) {

    public static final Settings DEFAULT = new Settings(Set.of(), null);

    public Settings {
        requiredRoles = Collections.unmodifiableSet(
                new LinkedHashSet<>(requiredRoles != null ? requiredRoles : Set.of()));
    }

    public Settings withMaxRoles(Integer value) {
        return new Settings(requiredRoles, value);
    }

    public Settings withRequiredRole(String roleId) {
        Set<String> next = new LinkedHashSet<>(requiredRoles);
        next.add(roleId);
        return new Settings(next, maxRoles);
    }

    public Settings withoutRequiredRoles() {
        return new Settings(Set.of(), maxRoles);
    }
}
