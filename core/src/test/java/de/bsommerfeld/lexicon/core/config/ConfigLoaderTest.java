package de.bsommerfeld.lexicon.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests loading config.toml from a temporary directory.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFile_shouldWriteDefaults() {
        Path configPath = tempDir.resolve("nested").resolve("config.toml");

        LexiconConfig config = ConfigLoader.load(configPath);

        assertTrue(Files.exists(configPath));
        assertEquals("dict.sqlite", config.getDatabase().getFileName());
        assertTrue(config.getDatabase().isTransactionalBulkAdd());
    }

    @Test
    void load_shouldReadTomlValues() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, """
                [database]
                directory = "/var/lib/lexicon"
                file-name = "custom.sqlite"
                transactional-bulk-add = false
                """);

        DatabaseConfig db = ConfigLoader.load(configPath).getDatabase();

        assertEquals("/var/lib/lexicon", db.getDirectory());
        assertEquals("custom.sqlite", db.getFileName());
        assertFalse(db.isTransactionalBulkAdd());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, """
                [database]
                file-name = "x.sqlite"
                cache-size = 42

                [ui]
                theme = "dark"
                """);

        assertEquals("x.sqlite", ConfigLoader.load(configPath).getDatabase().getFileName());
    }

    @Test
    void load_missingSection_shouldFallBackToDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "# empty\n");

        DatabaseConfig db = ConfigLoader.load(configPath).getDatabase();

        assertNotNull(db);
        assertEquals("dict.sqlite", db.getFileName());
    }

    @Test
    void save_thenLoad_shouldPreserveValues() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        LexiconConfig config = new LexiconConfig();
        config.getDatabase().setFileName("saved.sqlite");
        config.getDatabase().setTransactionalBulkAdd(false);

        ConfigLoader.save(config, configPath);
        DatabaseConfig loaded = ConfigLoader.load(configPath).getDatabase();

        assertEquals("saved.sqlite", loaded.getFileName());
        assertFalse(loaded.isTransactionalBulkAdd());
    }

    @Test
    void load_malformedToml_shouldThrow() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "[database\nfile-name = ");

        assertThrows(UncheckedIOException.class, () -> ConfigLoader.load(configPath));
    }
}
