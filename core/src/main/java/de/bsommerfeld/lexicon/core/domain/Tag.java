package de.bsommerfeld.lexicon.core.domain;

/**
 * Tag definition scoped to one dictionary. Used unchanged as insert shape and
 * lookup result.
 *
 * @param name       tag name as referenced from term and kanji rows
 * @param category   grouping category
 * @param order      sort key within the category
 * @param notes      human readable description
 * @param score      ranking contribution
 * @param dictionary owning dictionary title
 */
public record Tag(String name, String category, int order, String notes, int score, String dictionary) {
}
