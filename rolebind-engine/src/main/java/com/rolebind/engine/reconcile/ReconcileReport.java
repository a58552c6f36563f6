package com.rolebind.engine.reconcile;

import java.util.List;

/**
 * Outcome of {@code verify} or {@code cleanup} for one guild.
 *
 * @param messages        one report per active role message
 * @param staleMessageIds messages already marked stale; not counted as issues
 * @param repaired        whether the findings were applied (cleanup)
 */
public record ReconcileReport(
        String guildId,
        List<MessageReport> messages,
        List<String> staleMessageIds,
        boolean repaired) {

    public ReconcileReport {
        messages = List.copyOf(messages);
        staleMessageIds = List.copyOf(staleMessageIds);
    }

    /** Missing messages plus orphaned bindings. */
    public int issueCount() {
        return messages.stream().mapToInt(MessageReport::issueCount).sum();
    }

    public long missingMessages() {
        return messages.stream().filter(MessageReport::missing).count();
    }

    public int orphanedBindings() {
        return messages.stream().mapToInt(m -> m.orphanedBindings().size()).sum();
    }

    public int emptyCategories() {
        return messages.stream().mapToInt(m -> m.emptyCategories().size()).sum();
    }

    ReconcileReport asRepaired() {
        return new ReconcileReport(guildId, messages, staleMessageIds, true);
    }
}
