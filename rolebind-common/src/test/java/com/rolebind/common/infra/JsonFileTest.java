package com.rolebind.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTest {

    @TempDir
    Path tempDir;

    @Test
    void readTree_missingFile_returnsNull() throws IOException {
        assertNull(JsonFile.readTree(tempDir.resolve("absent.json")));
    }

    @Test
    void writeAtomic_createsParentDirsAndReplacesContent() throws IOException {
        Path target = tempDir.resolve("nested/dir/data.json");

        JsonFile.writeAtomic(target, Map.of("version", 1));
        JsonFile.writeAtomic(target, Map.of("version", 2));

        JsonNode tree = JsonFile.readTree(target);
        assertEquals(2, tree.get("version").asInt());
        try (var files = Files.list(target.getParent())) {
            assertEquals(1, files.count(), "temp files must not be left behind");
        }
    }

    @Test
    void readTree_invalidJson_throws() throws IOException {
        Path target = tempDir.resolve("broken.json");
        Files.writeString(target, "{ not json");

        assertThrows(IOException.class, () -> JsonFile.readTree(target));
    }
}
