package de.bsommerfeld.lexicon.db;

import de.bsommerfeld.lexicon.db.DatabaseStateException.Reason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests for SqliteConnection against a temporary SQLite file.
 */
class SqliteConnectionTest {

    @TempDir
    Path tempDir;

    private final SqliteConnection connection = new SqliteConnection();

    @AfterEach
    void tearDown() {
        connection.close();
    }

    @Test
    void open_shouldCreateParentDirectoriesAndSchema() throws Exception {
        Path file = tempDir.resolve("a").resolve("b").resolve("dict.sqlite");

        connection.open(file);

        assertTrue(Files.exists(file));
        assertTrue(connection.isOpen());
        try (Statement stmt = connection.getHandle().createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name IN "
                                + "('dictionaries','terms','term_meta','kanji','kanji_meta','tag_meta','media')")) {
            assertTrue(rs.next());
            assertEquals(7, rs.getInt(1));
        }
    }

    @Test
    void open_twice_shouldFailWithAlreadyOpen() {
        Path file = tempDir.resolve("dict.sqlite");
        connection.open(file);

        DatabaseStateException e = assertThrows(DatabaseStateException.class, () -> connection.open(file));
        assertEquals(Reason.ALREADY_OPEN, e.getReason());
    }

    @Test
    void open_whileOpening_shouldFailWithAlreadyOpening() {
        Path file = tempDir.resolve("dict.sqlite");
        AtomicReference<DatabaseStateException> nested = new AtomicReference<>();
        SqliteConnection reentrant = new SqliteConnection() {
            @Override
            Connection connect(Path databaseFile) throws SQLException {
                assertTrue(isOpening());
                nested.set(assertThrows(DatabaseStateException.class, () -> open(databaseFile)));
                return super.connect(databaseFile);
            }
        };

        reentrant.open(file);

        assertEquals(Reason.ALREADY_OPENING, nested.get().getReason());
        assertTrue(reentrant.isOpen());
        assertFalse(reentrant.isOpening());
        reentrant.close();
    }

    @Test
    void open_failure_shouldResetOpeningFlag() {
        SqliteConnection failing = new SqliteConnection() {
            @Override
            Connection connect(Path databaseFile) throws SQLException {
                throw new SQLException("disk on fire");
            }
        };

        assertThrows(DatabaseException.class, () -> failing.open(tempDir.resolve("dict.sqlite")));
        assertFalse(failing.isOpening());
        assertFalse(failing.isOpen());
    }

    @Test
    void getHandle_beforeOpen_shouldFailWithNotOpen() {
        DatabaseStateException e = assertThrows(DatabaseStateException.class, connection::getHandle);
        assertEquals(Reason.NOT_OPEN, e.getReason());
    }

    @Test
    void close_whenClosed_shouldBeNoOp() {
        assertDoesNotThrow(connection::close);
        connection.open(tempDir.resolve("dict.sqlite"));
        connection.close();
        assertDoesNotThrow(connection::close);
        assertFalse(connection.isOpen());
    }

    @Test
    void reopen_shouldKeepExistingRows() throws Exception {
        Path file = tempDir.resolve("dict.sqlite");
        connection.open(file);
        try (Statement stmt = connection.getHandle().createStatement()) {
            stmt.execute("INSERT INTO dictionaries (title, version) VALUES ('JMdict', 3)");
        }
        connection.close();

        connection.open(file);
        try (Statement stmt = connection.getHandle().createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM dictionaries")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void deleteBackingStore_shouldRemoveFileAndSideFiles() throws Exception {
        Path file = tempDir.resolve("dict.sqlite");
        Files.writeString(file, "x");
        Path journal = tempDir.resolve("dict.sqlite-journal");
        Files.writeString(journal, "x");

        connection.deleteBackingStore(file);

        assertFalse(Files.exists(file));
        assertFalse(Files.exists(journal));
    }

    @Test
    void deleteBackingStore_missingFile_shouldNotThrow() {
        assertDoesNotThrow(() -> connection.deleteBackingStore(tempDir.resolve("missing.sqlite")));
    }
}
