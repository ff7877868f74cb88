package de.bsommerfeld.lexicon.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row counts of one dictionary across the content stores.
 *
 * @param dictionary dictionary title
 * @param counts     store key ({@link ObjectStore#name()}) to row count, in
 *                   {@link ObjectStore#CONTENT_STORES} order
 */
public record DictionaryCountGroup(String dictionary, Map<String, Integer> counts) {

    public DictionaryCountGroup {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    /** Count for a store, 0 if the store was not counted. */
    public int get(ObjectStore<?> store) {
        return counts.getOrDefault(store.name(), 0);
    }
}
