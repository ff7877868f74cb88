package de.bsommerfeld.lexicon.db;

/**
 * A serialized column (glossary, meanings, stats, meta data, counts) holds
 * text that does not decode to the expected shape.
 */
public class PayloadDecodeException extends DatabaseException {

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
