package de.bsommerfeld.lexicon.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * String helpers shared by the storage layer.
 */
public final class TextUtils {

    private TextUtils() {
    }

    /**
     * Reverses a string by code point, so surrogate pairs (e.g. rare kanji
     * outside the BMP) stay intact. Reversing twice yields the input.
     *
     * @param text input, may be {@code null}
     * @return reversed text, {@code null} for {@code null} input
     */
    public static String reverse(String text) {
        if (text == null)
            return null;
        int[] codePoints = text.codePoints().toArray();
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = codePoints.length - 1; i >= 0; i--) {
            sb.appendCodePoint(codePoints[i]);
        }
        return sb.toString();
    }

    /**
     * Splits a space-separated token field on single ASCII spaces. An absent
     * or empty value yields an empty list, never a list holding one empty
     * string.
     *
     * @param value stored token field, may be {@code null}
     * @return immutable token list
     */
    public static List<String> splitTokens(String value) {
        if (value == null || value.isEmpty())
            return Collections.emptyList();
        List<String> tokens = new ArrayList<>();
        int start = 0;
        int next;
        while ((next = value.indexOf(' ', start)) >= 0) {
            tokens.add(value.substring(start, next));
            start = next + 1;
        }
        tokens.add(value.substring(start));
        return Collections.unmodifiableList(tokens);
    }
}
