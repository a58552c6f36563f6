package com.rolebind.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Set;
import java.util.UUID;

/**
 * JSON file load/save with owner-only permissions and atomic replacement.
 */
public final class JsonFile {

    private JsonFile() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Read a JSON file as a tree. Returns null if the file does not exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static JsonNode readTree(Path path) throws IOException {
        if (!Files.exists(path))
            return null;
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        if (raw.isBlank())
            return null;
        return MAPPER.readTree(raw);
    }

    /**
     * Write data as JSON: serialize to a sibling temp file, then move it over the
     * target so readers never observe a half-written document.
     */
    public static void writeAtomic(Path path, Object data, ObjectMapper mapper) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data) + "\n";
        Path tmp = (dir != null ? dir : Path.of("."))
                .resolve(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.writeString(tmp, json, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.setPosixFilePermissions(tmp, Set.of(
                        PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
            } catch (UnsupportedOperationException ignored) {
                // Non-POSIX file system
            }
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Write data with the default indenting mapper.
     */
    public static void writeAtomic(Path path, Object data) throws IOException {
        writeAtomic(path, data, MAPPER);
    }
}
