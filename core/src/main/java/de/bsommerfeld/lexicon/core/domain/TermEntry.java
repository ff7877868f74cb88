package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Decoded term row returned by term lookups.
 *
 * @param index          position of the originating query in the input list
 * @param matchType      strategy that produced the match
 * @param matchSource    column that produced the match
 * @param term           expression
 * @param reading        reading
 * @param definitionTags decoded definition tags, never {@code null}
 * @param termTags       decoded term tags, never {@code null}
 * @param rules          decoded rule names, never {@code null}
 * @param definitions    decoded glossary in stored order
 * @param score          ranking score
 * @param dictionary     owning dictionary title
 * @param id             row id
 * @param sequence       sequence number, 0 if absent
 */
public record TermEntry(
        int index,
        MatchType matchType,
        MatchSource matchSource,
        String term,
        String reading,
        List<String> definitionTags,
        List<String> termTags,
        List<String> rules,
        List<JsonNode> definitions,
        int score,
        String dictionary,
        long id,
        int sequence) {
}
