package de.bsommerfeld.lexicon.core.domain;

/**
 * Media lookup result.
 *
 * @param index position of the originating request
 * @param media the stored file
 */
public record MediaEntry(int index, MediaData media) {
}
