package de.bsommerfeld.lexicon.core.domain;

import java.util.Locale;

/**
 * Lookup strategy applied to a term or reading column.
 *
 * <ul>
 * <li>{@link #EXACT}: column equals the query</li>
 * <li>{@link #PREFIX}: column starts with the query</li>
 * <li>{@link #SUFFIX}: column ends with the query, answered as a prefix
 * match over the reversed shadow column</li>
 * <li>{@link #ANYWHERE}: column contains the query; never index-assisted</li>
 * </ul>
 */
public enum MatchType {

    EXACT,
    PREFIX,
    SUFFIX,
    ANYWHERE;

    /** Lower-case wire name, e.g. {@code "suffix"}. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name. {@code null} or blank input resolves to
     * {@link #EXACT}, the default strategy for term lookups.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static MatchType fromValue(String value) {
        if (value == null || value.isBlank())
            return EXACT;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
