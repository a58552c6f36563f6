package com.rolebind.engine.store;

import com.rolebind.engine.model.RoleMessage;

import java.util.List;
import java.util.Set;

/**
 * Key/value store of role messages, keyed by {@code (guildId, messageId)}.
 * <p>
 * The role message is the unit of consistency: {@link #put} replaces the whole
 * message and there are no partial-field updates. Callers read, modify a copy
 * and put it back; concurrent edits of the same message are last-writer-wins.
 */
public interface BindingStore {

    /** All role messages of the guild, stale ones included, in insertion order. */
    List<RoleMessage> get(String guildId);

    /** The role message, or null. */
    RoleMessage getMessage(String guildId, String messageId);

    /**
     * Insert or replace a role message.
     *
     * @throws com.rolebind.engine.PersistenceException if the durable write
     *                                                  failed; the in-memory
     *                                                  copy is kept
     */
    void put(String guildId, RoleMessage message);

    /**
     * Remove a role message. No-op when absent.
     *
     * @throws com.rolebind.engine.PersistenceException if the durable write
     *                                                  failed
     */
    void deleteMessage(String guildId, String messageId);

    /** Guilds that have at least one role message. */
    Set<String> guildIds();

    /**
     * Write pending changes. No-op for stores without durable backing.
     *
     * @throws com.rolebind.engine.PersistenceException if the write failed
     */
    default void flush() {
    }

    /** Whether some change has not reached durable storage yet. */
    default boolean isDirty() {
        return false;
    }
}
