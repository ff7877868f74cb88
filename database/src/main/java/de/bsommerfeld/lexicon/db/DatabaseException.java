package de.bsommerfeld.lexicon.db;

/**
 * Unchecked failure of a storage operation. Wraps the underlying
 * {@link java.sql.SQLException} or {@link java.io.IOException}; operations
 * are never retried.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
