package de.bsommerfeld.lexicon.db;

/**
 * Thrown when the store is used against its open/close lifecycle.
 */
public class DatabaseStateException extends DatabaseException {

    public enum Reason {
        /** {@code open} called while a handle is held. */
        ALREADY_OPEN,
        /** {@code open} called while another open is in flight. */
        ALREADY_OPENING,
        /** Handle requested before a successful {@code open}. */
        NOT_OPEN,
        /** {@code purge} called while an open is in flight; retry later. */
        PURGE_WHILE_OPENING
    }

    private final Reason reason;

    public DatabaseStateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
