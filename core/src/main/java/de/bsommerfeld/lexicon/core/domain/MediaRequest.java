package de.bsommerfeld.lexicon.core.domain;

/**
 * Media path qualified by its dictionary.
 */
public record MediaRequest(String path, String dictionary) {
}
