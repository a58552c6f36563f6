package com.rolebind.engine.reconcile;

import java.util.List;

/**
 * Findings for one active role message.
 *
 * @param channelId          channel the message was found in, or the stored
 *                           one when missing
 * @param missing            the platform message no longer exists
 * @param lookupError        the message could not be checked, nullable
 * @param orphanedBindings   bindings whose role is gone
 * @param emptyCategories    categories that are empty, or become empty once
 *                           the orphaned bindings are removed
 * @param unmanageableRoles  bound roles the bot cannot assign (at or above its
 *                           highest role, or integration-managed)
 */
public record MessageReport(
        String messageId,
        String channelId,
        boolean missing,
        String lookupError,
        List<OrphanedBinding> orphanedBindings,
        List<String> emptyCategories,
        List<String> unmanageableRoles) {

    public MessageReport {
        orphanedBindings = List.copyOf(orphanedBindings);
        emptyCategories = List.copyOf(emptyCategories);
        unmanageableRoles = List.copyOf(unmanageableRoles);
    }

    public int issueCount() {
        return (missing ? 1 : 0) + orphanedBindings.size();
    }

    public boolean clean() {
        return issueCount() == 0 && emptyCategories.isEmpty() && unmanageableRoles.isEmpty()
                && lookupError == null;
    }
}
