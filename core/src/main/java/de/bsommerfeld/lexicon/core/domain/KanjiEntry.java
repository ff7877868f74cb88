package de.bsommerfeld.lexicon.core.domain;

import java.util.List;
import java.util.Map;

/**
 * Decoded kanji row.
 *
 * @param index       position of the originating character in the input list
 * @param character   the kanji
 * @param onyomi      on readings
 * @param kunyomi     kun readings
 * @param tags        tags
 * @param definitions meanings in stored order
 * @param stats       stats in stored order, empty if absent
 * @param dictionary  owning dictionary title
 */
public record KanjiEntry(
        int index,
        String character,
        List<String> onyomi,
        List<String> kunyomi,
        List<String> tags,
        List<String> definitions,
        Map<String, String> stats,
        String dictionary) {
}
