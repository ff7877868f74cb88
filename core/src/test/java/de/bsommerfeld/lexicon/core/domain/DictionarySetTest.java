package de.bsommerfeld.lexicon.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DictionarySetTest {

    @Test
    void of_shouldContainGivenNames() {
        DictionarySet set = DictionarySet.of("JMdict", "KANJIDIC");

        assertTrue(set.has("JMdict"));
        assertTrue(set.has("KANJIDIC"));
        assertFalse(set.has("Jitendex"));
    }

    @Test
    void of_shouldNotSeeLaterChangesToSource() {
        List<String> names = new ArrayList<>(List.of("JMdict"));
        DictionarySet set = DictionarySet.of(names);

        names.add("Jitendex");

        assertFalse(set.has("Jitendex"));
    }

    @Test
    void lambda_shouldActAsPredicate() {
        DictionarySet startsWithJ = name -> name.startsWith("J");

        assertTrue(startsWithJ.has("JMdict"));
        assertFalse(startsWithJ.has("KANJIDIC"));
    }
}
