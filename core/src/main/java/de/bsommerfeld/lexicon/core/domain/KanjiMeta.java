package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded kanji metadata row.
 */
public record KanjiMeta(int index, String character, String mode, JsonNode data, String dictionary) {
}
