package de.bsommerfeld.lexicon.core.domain;

/**
 * How a frequency dictionary ranks its entries. Dictionaries without
 * frequency data carry no mode at all ({@code null}).
 */
public enum FrequencyMode {

    OCCURRENCE_BASED("occurrence-based"),
    RANK_BASED("rank-based");

    private final String value;

    FrequencyMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a persisted value. Unknown or absent values map to
     * {@code null} so that rows written by newer importers stay readable.
     */
    public static FrequencyMode fromValue(String value) {
        if (value == null)
            return null;
        for (FrequencyMode mode : values()) {
            if (mode.value.equals(value))
                return mode;
        }
        return null;
    }
}
