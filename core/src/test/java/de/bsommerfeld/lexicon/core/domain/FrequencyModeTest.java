package de.bsommerfeld.lexicon.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyModeTest {

    @Test
    void fromValue_shouldResolveKnownModes() {
        assertEquals(FrequencyMode.OCCURRENCE_BASED, FrequencyMode.fromValue("occurrence-based"));
        assertEquals(FrequencyMode.RANK_BASED, FrequencyMode.fromValue("rank-based"));
    }

    @Test
    void fromValue_unknownOrNull_shouldReturnNull() {
        assertNull(FrequencyMode.fromValue(null));
        assertNull(FrequencyMode.fromValue("percentile"));
    }

    @Test
    void value_shouldRoundTripThroughFromValue() {
        for (FrequencyMode mode : FrequencyMode.values())
            assertSame(mode, FrequencyMode.fromValue(mode.value()));
    }
}
