package com.rolebind.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The persisted (role, mode) pair a trigger resolves to.
 *
 * @param roleId      bound role
 * @param mode        conflict-resolution mode
 * @param label       button label or menu option text, nullable
 * @param emoji       emoji shown on the component, nullable
 * @param description menu option description, nullable
 * @param orphaned    the role was found missing; excluded from resolution
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Binding(
        String roleId,
        BindingMode mode,
        String label,
        String emoji,
        String description,
        boolean orphaned) {

    public Binding {
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("roleId is required");
        }
        mode = mode != null ? mode : BindingMode.NORMAL;
    }

    public static Binding of(String roleId, BindingMode mode) {
        return new Binding(roleId, mode, null, null, null, false);
    }

    public Binding withOrphaned(boolean value) {
        return new Binding(roleId, mode, label, emoji, description, value);
    }
}
