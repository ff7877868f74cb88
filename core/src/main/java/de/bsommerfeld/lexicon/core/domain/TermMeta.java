package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decoded term metadata row.
 */
public record TermMeta(int index, String term, String mode, JsonNode data, String dictionary) {
}
