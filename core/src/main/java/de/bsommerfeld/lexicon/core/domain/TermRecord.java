package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A term row as delivered by the importer. Token fields are kept in their
 * space-separated form; reversed copies of expression and reading are never
 * part of the input and are derived when the row is written.
 *
 * @param dictionary     owning dictionary title
 * @param expression     written form
 * @param reading        reading of the written form
 * @param definitionTags space-separated tags, may be {@code null}
 * @param tags           legacy alias of {@code definitionTags}, used only when
 *                       {@code definitionTags} is absent
 * @param rules          space-separated deinflection rule names
 * @param score          ranking score
 * @param glossary       ordered definition entries
 * @param sequence       cross-reference group, {@code null} if absent
 * @param termTags       space-separated term tags, may be {@code null}
 */
public record TermRecord(
        String dictionary,
        String expression,
        String reading,
        String definitionTags,
        String tags,
        String rules,
        int score,
        List<JsonNode> glossary,
        Integer sequence,
        String termTags) {

    public TermRecord(String dictionary, String expression, String reading, String definitionTags,
            String rules, int score, List<JsonNode> glossary, Integer sequence, String termTags) {
        this(dictionary, expression, reading, definitionTags, null, rules, score, glossary, sequence, termTags);
    }

    /** Definition tags, falling back to the legacy {@code tags} field. */
    public String effectiveDefinitionTags() {
        return definitionTags != null && !definitionTags.isEmpty() ? definitionTags : tags;
    }
}
