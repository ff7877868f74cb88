package de.bsommerfeld.lexicon.core.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

/**
 * Caller-owned predicate over dictionary names. Lookups evaluate it per
 * candidate row after retrieval, so the enabled set may be computed on the
 * fly and never has to exist as persisted state.
 */
@FunctionalInterface
public interface DictionarySet {

    /**
     * @param dictionaryName the {@code dictionary} column of a candidate row
     * @return {@code true} if rows from this dictionary should be returned
     */
    boolean has(String dictionaryName);

    /** Fixed set of enabled dictionary names. */
    static DictionarySet of(Collection<String> names) {
        Set<String> enabled = Set.copyOf(names);
        return enabled::contains;
    }

    static DictionarySet of(String... names) {
        return of(Arrays.asList(names));
    }
}
