package de.bsommerfeld.lexicon.core.domain;

import java.util.Locale;

/**
 * Which column of a term row produced a match.
 */
public enum MatchSource {

    TERM,
    READING,
    SEQUENCE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
