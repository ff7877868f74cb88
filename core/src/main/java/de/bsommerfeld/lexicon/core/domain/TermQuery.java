package de.bsommerfeld.lexicon.core.domain;

/**
 * Expression/reading pair for exact two-column term lookups.
 */
public record TermQuery(String term, String reading) {
}
