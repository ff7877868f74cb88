package de.bsommerfeld.lexicon.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a count request.
 *
 * @param counts one group per requested dictionary, in request order
 * @param total  element-wise sum of all groups, {@code null} unless totals
 *               were requested
 */
public record DictionaryCounts(List<DictionaryCountGroup> counts, Map<String, Integer> total) {

    public DictionaryCounts {
        counts = List.copyOf(counts);
        total = total == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(total));
    }
}
