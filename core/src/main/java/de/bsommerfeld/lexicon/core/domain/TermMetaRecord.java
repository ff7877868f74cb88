package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Term metadata row as delivered by the importer.
 *
 * @param dictionary owning dictionary title
 * @param expression the term the metadata belongs to
 * @param mode       payload discriminator ({@code freq}, {@code pitch},
 *                   {@code ipa})
 * @param data       mode-specific payload
 */
public record TermMetaRecord(String dictionary, String expression, String mode, JsonNode data) {
}
