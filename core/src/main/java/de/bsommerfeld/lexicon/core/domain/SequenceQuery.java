package de.bsommerfeld.lexicon.core.domain;

/**
 * Sequence number qualified by its dictionary. Sequence numbers are only
 * unique within one dictionary.
 */
public record SequenceQuery(int sequence, String dictionary) {
}
