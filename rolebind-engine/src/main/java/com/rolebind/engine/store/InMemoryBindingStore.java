package com.rolebind.engine.store;

import com.rolebind.engine.model.RoleMessage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map-backed binding store. Role messages are immutable, so returning the
 * stored instances is safe.
 */
public class InMemoryBindingStore implements BindingStore {

    private final Map<String, Map<String, RoleMessage>> guilds = new LinkedHashMap<>();

    @Override
    public synchronized List<RoleMessage> get(String guildId) {
        Map<String, RoleMessage> messages = guilds.get(guildId);
        return messages != null ? List.copyOf(messages.values()) : List.of();
    }

    @Override
    public synchronized RoleMessage getMessage(String guildId, String messageId) {
        Map<String, RoleMessage> messages = guilds.get(guildId);
        return messages != null ? messages.get(messageId) : null;
    }

    @Override
    public void put(String guildId, RoleMessage message) {
        putInMemory(guildId, message);
    }

    @Override
    public void deleteMessage(String guildId, String messageId) {
        deleteInMemory(guildId, messageId);
    }

    @Override
    public synchronized Set<String> guildIds() {
        return new LinkedHashSet<>(guilds.keySet());
    }

    protected synchronized void putInMemory(String guildId, RoleMessage message) {
        guilds.computeIfAbsent(guildId, k -> new LinkedHashMap<>()).put(message.id(), message);
    }

    protected synchronized boolean deleteInMemory(String guildId, String messageId) {
        Map<String, RoleMessage> messages = guilds.get(guildId);
        if (messages == null || messages.remove(messageId) == null) {
            return false;
        }
        if (messages.isEmpty()) {
            guilds.remove(guildId);
        }
        return true;
    }

    /**
     * Copy of the full content, guild id to message id to message.
     */
    protected synchronized Map<String, Map<String, RoleMessage>> snapshot() {
        Map<String, Map<String, RoleMessage>> copy = new LinkedHashMap<>();
        for (var entry : guilds.entrySet()) {
            copy.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
        }
        return copy;
    }

    protected synchronized void replaceAll(Map<String, Map<String, RoleMessage>> content) {
        guilds.clear();
        for (var entry : content.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                guilds.put(entry.getKey(), new LinkedHashMap<>(entry.getValue()));
            }
        }
    }

    /** Number of stored role messages across all guilds. */
    public synchronized int size() {
        int total = 0;
        for (Map<String, RoleMessage> messages : guilds.values()) {
            total += messages.size();
        }
        return total;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{guilds=" + new ArrayList<>(guildIds()) + "}";
    }
}
