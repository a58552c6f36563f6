package com.rolebind.common.config;

import lombok.Data;

/**
 * Root configuration type for RoleBind.
 */
@Data
public class RoleBindConfig {

    /** Discord connection settings. */
    private DiscordConfig discord;

    /** Binding store settings. */
    private StorageConfig storage;

    // --- Nested config types ---

    @Data
    public static class DiscordConfig {
        /** Bot token; "Bot " prefix is tolerated. */
        private String token;
        /** Threads that run role activations. */
        private int workerThreads = 1;
    }

    @Data
    public static class StorageConfig {
        private String path = "~/.rolebind/reaction_roles.json";
        /** Interval of the background flush that retries failed writes. */
        private long flushIntervalMs = 300_000;
    }
}
