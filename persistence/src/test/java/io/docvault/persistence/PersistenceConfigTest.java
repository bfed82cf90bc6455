package io.docvault.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceConfigTest {

    @Test
    void defaults_keep_compaction_strict_and_deltas_lenient() {
        PersistenceConfig config = PersistenceConfig.of("app", "docs");

        assertFalse(config.inMemoryOnly());
        assertEquals(RecordErrorPolicy.ABORT, config.compactionErrorPolicy());
        assertEquals(RecordErrorPolicy.CONTINUE, config.deltaErrorPolicy());
        assertEquals(PersistenceConfig.DEFAULT_MAX_UPGRADE_ATTEMPTS, config.maxUpgradeAttempts());
    }

    @Test
    void json_file_overrides_only_the_fields_it_names(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("persistence.json");
        Files.writeString(file, """
                {
                  "databaseName": "app",
                  "storeName": "docs",
                  "deltaErrorPolicy": "abort",
                  "maxUpgradeAttempts": 2
                }
                """);

        PersistenceConfig config = PersistenceConfig.fromJsonFile(file);

        assertEquals("app", config.databaseName());
        assertEquals("docs", config.storeName());
        assertEquals(RecordErrorPolicy.ABORT, config.deltaErrorPolicy());
        assertEquals(RecordErrorPolicy.ABORT, config.compactionErrorPolicy());
        assertEquals(2, config.maxUpgradeAttempts());
        assertFalse(config.inMemoryOnly());
    }

    @Test
    void missing_file_fails_with_its_path(@TempDir Path dir) {
        Path file = dir.resolve("absent.json");

        var ex = assertThrows(RuntimeException.class, () -> PersistenceConfig.fromJsonFile(file));
        assertTrue(ex.getMessage().contains("absent.json"));
    }

    @Test
    void invalid_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PersistenceConfig.of(" ", "docs"));
        assertThrows(IllegalArgumentException.class, () -> PersistenceConfig.of("app", "docs").withMaxUpgradeAttempts(0));
    }
}
