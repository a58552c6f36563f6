package com.rolebind.engine.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolebind.common.infra.JsonFile;
import com.rolebind.engine.PersistenceException;
import com.rolebind.engine.model.RoleMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binding store persisted as a single JSON document.
 * <p>
 * The in-memory map is authoritative. Each mutation is applied in memory
 * first and then written through; a failed write leaves the store dirty and
 * surfaces as {@link PersistenceException}, and a later {@link #flush()}
 * retries.
 */
@Slf4j
public class JsonFileBindingStore extends InMemoryBindingStore {

    private final Path path;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();

    /** Bumped on every in-memory change. */
    private final AtomicLong generation = new AtomicLong();
    /** Generation last written to disk. */
    private final AtomicLong persisted = new AtomicLong();

    public JsonFileBindingStore(Path path) {
        this(path, defaultMapper());
    }

    public JsonFileBindingStore(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
        load();
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getPath() {
        return path;
    }

    // =========================================================================
    // Load
    // =========================================================================

    private void load() {
        BindingDocument document;
        try {
            document = ConfigMigrator.migrate(JsonFile.readTree(path), mapper);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read binding document " + path + ": " + e.getMessage(), e);
        }
        replaceAll(document.guilds());
        log.info("Loaded {} role messages in {} guilds from {}", size(), guildIds().size(), path);
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    @Override
    public void put(String guildId, RoleMessage message) {
        putInMemory(guildId, message);
        generation.incrementAndGet();
        write();
    }

    @Override
    public void deleteMessage(String guildId, String messageId) {
        if (deleteInMemory(guildId, messageId)) {
            generation.incrementAndGet();
            write();
        }
    }

    @Override
    public void flush() {
        if (isDirty()) {
            write();
            log.debug("Flushed binding document to {}", path);
        }
    }

    @Override
    public boolean isDirty() {
        return persisted.get() != generation.get();
    }

    private void write() {
        synchronized (writeLock) {
            long target = generation.get();
            if (persisted.get() == target) {
                return;
            }
            Map<String, Map<String, RoleMessage>> content = snapshot();
            try {
                JsonFile.writeAtomic(path, new BindingDocument(ConfigMigrator.CURRENT_VERSION, content), mapper);
            } catch (IOException e) {
                throw new PersistenceException("Failed to write binding document " + path + ": " + e.getMessage(), e);
            }
            // snapshot may already contain later changes; those are written again on the next call
            persisted.set(target);
        }
    }
}
