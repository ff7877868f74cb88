package de.bsommerfeld.lexicon.core.domain;

/**
 * Tag name qualified by its dictionary.
 */
public record TagQuery(String name, String dictionary) {
}
