package de.bsommerfeld.lexicon.core.domain;

import java.util.List;
import java.util.Map;

/**
 * Kanji row as delivered by the importer.
 *
 * @param dictionary owning dictionary title
 * @param character  the kanji
 * @param onyomi     space-separated on readings
 * @param kunyomi    space-separated kun readings
 * @param tags       space-separated tags
 * @param meanings   ordered meanings
 * @param stats      stat name to value, {@code null} if absent
 */
public record KanjiRecord(
        String dictionary,
        String character,
        String onyomi,
        String kunyomi,
        String tags,
        List<String> meanings,
        Map<String, String> stats) {
}
