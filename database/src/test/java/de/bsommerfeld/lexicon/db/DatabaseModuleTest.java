package de.bsommerfeld.lexicon.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.lexicon.core.config.DatabaseConfig;
import de.bsommerfeld.lexicon.core.config.LexiconConfig;
import de.bsommerfeld.lexicon.core.domain.DictionarySummary;
import de.bsommerfeld.lexicon.core.domain.ObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the Guice wiring from config.toml to a usable dictionary store.
 */
class DatabaseModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldBindSqlImplementationAsSingleton() {
        Injector injector = Guice.createInjector(new DatabaseModule(tempDir.resolve("config.toml")));

        DictionaryDatabase first = injector.getInstance(DictionaryDatabase.class);
        DictionaryDatabase second = injector.getInstance(DictionaryDatabase.class);

        assertInstanceOf(SqlDictionaryDatabase.class, first);
        assertSame(first, second);
        assertFalse(first.isPrepared());
    }

    @Test
    void injector_shouldWriteDefaultConfigAndBindSections() {
        Path configPath = tempDir.resolve("config.toml");
        Injector injector = Guice.createInjector(new DatabaseModule(configPath));

        assertTrue(Files.exists(configPath));
        LexiconConfig config = injector.getInstance(LexiconConfig.class);
        assertSame(config.getDatabase(), injector.getInstance(DatabaseConfig.class));
    }

    @Test
    void injectedDatabase_shouldUseConfiguredLocation() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Path dataDir = tempDir.resolve("data");
        Files.writeString(configPath, "[database]\n"
                + "directory = '" + dataDir.toAbsolutePath() + "'\n"
                + "file-name = 'wired.sqlite'\n");

        try (DictionaryDatabase db = Guice.createInjector(new DatabaseModule(configPath))
                .getInstance(DictionaryDatabase.class)) {
            db.prepare();
            db.bulkAdd(ObjectStore.DICTIONARIES, List.of(new DictionarySummary("D", 3, "1")), 0, 1);

            assertTrue(db.dictionaryExists("D"));
            assertTrue(Files.exists(dataDir.resolve("wired.sqlite")));
        }
    }
}
