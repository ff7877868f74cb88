package de.bsommerfeld.lexicon.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchTypeTest {

    @Test
    void fromValue_shouldParseWireNames() {
        assertEquals(MatchType.EXACT, MatchType.fromValue("exact"));
        assertEquals(MatchType.PREFIX, MatchType.fromValue("prefix"));
        assertEquals(MatchType.SUFFIX, MatchType.fromValue("suffix"));
        assertEquals(MatchType.ANYWHERE, MatchType.fromValue("anywhere"));
    }

    @Test
    void fromValue_nullOrBlank_shouldDefaultToExact() {
        assertEquals(MatchType.EXACT, MatchType.fromValue(null));
        assertEquals(MatchType.EXACT, MatchType.fromValue("  "));
    }

    @Test
    void fromValue_unknown_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> MatchType.fromValue("fuzzy"));
    }

    @Test
    void value_shouldBeLowerCase() {
        assertEquals("anywhere", MatchType.ANYWHERE.value());
    }
}
