package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Kanji metadata row as delivered by the importer.
 *
 * @param dictionary owning dictionary title
 * @param character  the kanji the metadata belongs to
 * @param mode       payload discriminator ({@code freq}, stats class)
 * @param data       mode-specific payload
 */
public record KanjiMetaRecord(String dictionary, String character, String mode, JsonNode data) {
}
