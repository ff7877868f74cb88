package de.bsommerfeld.lexicon.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Metadata of one imported dictionary. Written once per import and never
 * updated in place.
 *
 * @param title                    unique dictionary name, referenced by every
 *                                 content row
 * @param version                  dictionary format version
 * @param revision                 dictionary revision, empty if the archive
 *                                 declares none
 * @param sequenced                whether term entries carry sequence numbers
 * @param author                   optional author
 * @param url                      optional homepage
 * @param description              optional description
 * @param attribution              optional attribution text
 * @param frequencyMode            ranking mode of frequency data, {@code null}
 *                                 if absent
 * @param prefixWildcardsSupported whether prefix wildcard lookups were enabled
 *                                 at import time
 * @param styles                   opaque stylesheet text, empty if absent
 * @param counts                   aggregate row counts recorded by the
 *                                 importer, {@code null} if absent
 * @param yomitanVersion           version tag of the importing tool
 */
public record DictionarySummary(
        String title,
        int version,
        String revision,
        boolean sequenced,
        String author,
        String url,
        String description,
        String attribution,
        FrequencyMode frequencyMode,
        boolean prefixWildcardsSupported,
        String styles,
        JsonNode counts,
        String yomitanVersion) {

    /**
     * Minimal summary without optional metadata.
     */
    public DictionarySummary(String title, int version, String revision) {
        this(title, version, revision, false, null, null, null, null, null,
                false, "", null, null);
    }
}
