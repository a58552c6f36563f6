package com.rolebind.engine.store;

import com.rolebind.engine.model.RoleMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the persisted configuration file.
 *
 * @param version schema version, see {@link ConfigMigrator#CURRENT_VERSION}
 * @param guilds  guild id to message id to role message
 */
public record BindingDocument(int version, Map<String, Map<String, RoleMessage>> guilds) {

    public BindingDocument {
        guilds = guilds != null ? guilds : new LinkedHashMap<>();
    }

    public static BindingDocument empty() {
        return new BindingDocument(ConfigMigrator.CURRENT_VERSION, new LinkedHashMap<>());
    }
}
