package de.bsommerfeld.lexicon.core.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    // -- reverse --

    @Test
    void reverse_shouldReverseAscii() {
        assertEquals("cba", TextUtils.reverse("abc"));
    }

    @Test
    void reverse_shouldReverseJapanese() {
        assertEquals("るべた", TextUtils.reverse("たべる"));
    }

    @Test
    void reverse_shouldKeepSurrogatePairsIntact() {
        // U+20BB7 is outside the BMP and encoded as two chars
        String input = "a𠮷b";
        String reversed = TextUtils.reverse(input);

        assertEquals("b𠮷a", reversed);
        assertEquals(input, TextUtils.reverse(reversed));
    }

    @Test
    void reverse_shouldReturnEmptyForEmpty() {
        assertEquals("", TextUtils.reverse(""));
    }

    @Test
    void reverse_shouldReturnNullForNull() {
        assertNull(TextUtils.reverse(null));
    }

    // -- splitTokens --

    @Test
    void splitTokens_shouldSplitOnSpaces() {
        assertEquals(List.of("v1", "vt"), TextUtils.splitTokens("v1 vt"));
    }

    @Test
    void splitTokens_shouldReturnEmptyListForEmptyOrNull() {
        assertTrue(TextUtils.splitTokens("").isEmpty());
        assertTrue(TextUtils.splitTokens(null).isEmpty());
    }

    @Test
    void splitTokens_shouldBeUnmodifiable() {
        List<String> tokens = TextUtils.splitTokens("a b");
        assertThrows(UnsupportedOperationException.class, () -> tokens.add("c"));
    }
}
