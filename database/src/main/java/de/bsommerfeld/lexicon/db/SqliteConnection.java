package de.bsommerfeld.lexicon.db;

import de.bsommerfeld.lexicon.db.DatabaseStateException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the single JDBC handle to a SQLite file.
 *
 * <h3>Lifecycle</h3>
 * {@link #open(Path)} is single-flight: a second call while one is in
 * progress fails with {@link Reason#ALREADY_OPENING} instead of queueing,
 * and a call while a handle is held fails with {@link Reason#ALREADY_OPEN}.
 * Opening creates missing parent directories and applies {@code schema.sql},
 * whose statements are all {@code IF NOT EXISTS}.
 *
 * <p>
 * No locking beyond the opening flag: callers serialize queries and writes
 * on the handle themselves.
 */
public class SqliteConnection {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteConnection.class);

    private static final String[] SIDE_FILE_SUFFIXES = { "-journal", "-wal", "-shm" };

    private final AtomicBoolean opening = new AtomicBoolean(false);
    private volatile Connection connection;

    /**
     * Opens or creates the database file and ensures every table and index
     * exists.
     *
     * @throws DatabaseStateException if already open or opening
     * @throws DatabaseException      if the file cannot be created or the
     *                                schema cannot be applied
     */
    public void open(Path databaseFile) {
        if (connection != null)
            throw new DatabaseStateException(Reason.ALREADY_OPEN, "Database already open");
        if (!opening.compareAndSet(false, true))
            throw new DatabaseStateException(Reason.ALREADY_OPENING, "Already opening");

        try {
            if (connection != null)
                throw new DatabaseStateException(Reason.ALREADY_OPEN, "Database already open");

            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);

            Connection conn = connect(databaseFile);
            try {
                applySchema(conn);
            } catch (SQLException e) {
                conn.close();
                throw e;
            }
            connection = conn;
            LOG.info("Opened dictionary database at {}", databaseFile);
        } catch (IOException e) {
            throw new DatabaseException("Failed to create database directory for " + databaseFile, e);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to open database " + databaseFile, e);
        } finally {
            opening.set(false);
        }
    }

    Connection connect(Path databaseFile) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
    }

    /**
     * Applies the DDL from {@code schema.sql} in one transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        List<String> statements = SqlLoader.loadScript("schema");
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : statements)
                stmt.execute(sql);
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
        LOG.debug("Schema applied ({} statements).", statements.size());
    }

    /**
     * Releases the handle. No-op when already closed.
     */
    public void close() {
        Connection conn = connection;
        if (conn == null)
            return;
        connection = null;
        try {
            conn.close();
            LOG.info("Closed dictionary database.");
        } catch (SQLException e) {
            throw new DatabaseException("Failed to close database", e);
        }
    }

    /** Whether an {@link #open(Path)} call is in flight. */
    public boolean isOpening() {
        return opening.get();
    }

    public boolean isOpen() {
        return connection != null;
    }

    /**
     * @throws DatabaseStateException with {@link Reason#NOT_OPEN} before a
     *                                successful open
     */
    public Connection getHandle() {
        Connection conn = connection;
        if (conn == null)
            throw new DatabaseStateException(Reason.NOT_OPEN, "Database not open");
        return conn;
    }

    /**
     * Deletes the database file and any SQLite journal side files. A missing
     * file is not an error.
     *
     * @throws IOException for any other deletion failure
     */
    public void deleteBackingStore(Path databaseFile) throws IOException {
        try {
            Files.delete(databaseFile);
        } catch (NoSuchFileException e) {
            LOG.debug("No database file to delete at {}", databaseFile);
        }
        for (String suffix : SIDE_FILE_SUFFIXES) {
            Files.deleteIfExists(databaseFile.resolveSibling(databaseFile.getFileName() + suffix));
        }
    }
}
