package de.bsommerfeld.lexicon.db;

import de.bsommerfeld.lexicon.core.domain.DictionaryCounts;
import de.bsommerfeld.lexicon.core.domain.DictionarySet;
import de.bsommerfeld.lexicon.core.domain.DictionarySummary;
import de.bsommerfeld.lexicon.core.domain.KanjiEntry;
import de.bsommerfeld.lexicon.core.domain.KanjiMeta;
import de.bsommerfeld.lexicon.core.domain.MatchType;
import de.bsommerfeld.lexicon.core.domain.MediaEntry;
import de.bsommerfeld.lexicon.core.domain.MediaRequest;
import de.bsommerfeld.lexicon.core.domain.ObjectStore;
import de.bsommerfeld.lexicon.core.domain.SequenceQuery;
import de.bsommerfeld.lexicon.core.domain.Tag;
import de.bsommerfeld.lexicon.core.domain.TagQuery;
import de.bsommerfeld.lexicon.core.domain.TermEntry;
import de.bsommerfeld.lexicon.core.domain.TermMeta;
import de.bsommerfeld.lexicon.core.domain.TermQuery;

import java.util.List;
import java.util.Map;

/**
 * Storage contract for imported dictionaries. This is the entire surface the
 * translator, display and import layers may call.
 *
 * <p>
 * Bulk lookups take an ordered input list and return a flat result list in
 * which every entry carries the {@code index} of the input that produced it.
 * Results for one input keep storage order; inputs are processed in list
 * order. An empty input list returns an empty list without touching storage.
 * A {@code null} element matches nothing; its index simply produces no
 * entries.
 *
 * <p>
 * Lookups that take a {@link DictionarySet} drop rows whose dictionary the set
 * does not contain. Implementations are not thread-safe: callers serialize
 * access.
 *
 * <p>
 * Unexpected storage failures surface as {@link DatabaseException}; lifecycle
 * misuse as {@link DatabaseStateException}; undecodable payloads fail the
 * whole call with {@link PayloadDecodeException}.
 */
public interface DictionaryDatabase extends AutoCloseable {

    // -- Lifecycle --

    /** Opens the store, creating file, tables and indexes as needed. */
    void prepare();

    @Override
    void close();

    boolean isPrepared();

    /**
     * Deletes the store and reopens it empty. Reopening happens even when
     * deletion fails.
     *
     * @return whether the backing file was deleted
     * @throws DatabaseStateException while the store is mid-open
     */
    boolean purge();

    // -- Lookups --

    default List<TermEntry> findTermsBulk(List<String> terms, DictionarySet dictionaries) {
        return findTermsBulk(terms, dictionaries, MatchType.EXACT);
    }

    /** Matches each input against the expression column. */
    List<TermEntry> findTermsBulk(List<String> terms, DictionarySet dictionaries, MatchType matchType);

    /** Matches each input against the reading column. */
    List<TermEntry> findTermsByReadingBulk(List<String> readings, DictionarySet dictionaries, MatchType matchType);

    /** Exact match on expression and reading together. */
    List<TermEntry> findTermsExactBulk(List<TermQuery> queries, DictionarySet dictionaries);

    /** Exact match on sequence number within the query's dictionary. */
    List<TermEntry> findTermsBySequenceBulk(List<SequenceQuery> queries, DictionarySet dictionaries);

    List<TermMeta> findTermMetaBulk(List<String> terms, DictionarySet dictionaries);

    List<KanjiEntry> findKanjiBulk(List<String> characters, DictionarySet dictionaries);

    List<KanjiMeta> findKanjiMetaBulk(List<String> characters, DictionarySet dictionaries);

    /** Exact match on name and dictionary; no dictionary-set filter. */
    List<Tag> findTagMetaBulk(List<TagQuery> queries);

    /**
     * Tags whose name matches a SQL {@code LIKE} pattern ({@code %} any run,
     * {@code _} one character), across all dictionaries.
     */
    List<Tag> findTagForTitle(String titlePattern);

    /** Media files by path within the request's dictionary. */
    List<MediaEntry> getMedia(List<MediaRequest> requests);

    // -- Aggregates --

    List<DictionarySummary> getDictionaryInfo();

    DictionaryCounts getDictionaryCounts(List<String> dictionaryNames, boolean includeTotal);

    boolean dictionaryExists(String title);

    // -- Mutation --

    /**
     * Inserts {@code items[start, min(start + count, items.size()))} in order.
     * No-op for an empty list or {@code count <= 0}.
     */
    <T> void bulkAdd(ObjectStore<T> store, List<T> items, int start, int count);

    /**
     * Removes a dictionary and all of its rows.
     *
     * @return rows deleted per store key, including {@code dictionaries}
     */
    Map<String, Integer> deleteDictionary(String title);
}
