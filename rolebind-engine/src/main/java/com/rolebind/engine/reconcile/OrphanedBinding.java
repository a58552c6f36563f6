package com.rolebind.engine.reconcile;

/**
 * A binding whose role no longer exists in the guild.
 *
 * @param triggerKey trigger key, or the role id for menu options
 * @param categoryId owning category for menu options, nullable
 */
public record OrphanedBinding(String triggerKey, String roleId, String categoryId) {
}
