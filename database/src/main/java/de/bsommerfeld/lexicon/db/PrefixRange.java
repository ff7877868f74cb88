package de.bsommerfeld.lexicon.db;

/**
 * Turns a prefix match into a half-open range {@code [prefix, upperBound)}.
 *
 * <p>
 * SQLite's {@code BINARY} collation compares UTF-8 bytes, which orders text
 * by code point. Every string starting with {@code p} therefore sorts at or
 * after {@code p} and strictly before the string obtained by incrementing the
 * last incrementable code point of {@code p}. Unlike {@code LIKE 'p%'}, the
 * range is answered by an ordinary index seek regardless of collation.
 */
final class PrefixRange {

    private PrefixRange() {
    }

    /**
     * Smallest string greater than every string that starts with
     * {@code prefix}, or {@code null} if none exists (empty prefix, or a
     * prefix made only of {@link Character#MAX_CODE_POINT}).
     */
    static String upperBound(String prefix) {
        int[] codePoints = prefix.codePoints().toArray();
        for (int i = codePoints.length - 1; i >= 0; i--) {
            int next = codePoints[i] + 1;
            if (next >= Character.MIN_SURROGATE && next <= Character.MAX_SURROGATE)
                next = Character.MAX_SURROGATE + 1;
            if (next <= Character.MAX_CODE_POINT) {
                StringBuilder sb = new StringBuilder();
                for (int j = 0; j < i; j++)
                    sb.appendCodePoint(codePoints[j]);
                return sb.appendCodePoint(next).toString();
            }
        }
        return null;
    }
}
