package de.bsommerfeld.lexicon.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.lexicon.core.config.DatabaseConfig;
import de.bsommerfeld.lexicon.core.domain.DictionaryCountGroup;
import de.bsommerfeld.lexicon.core.domain.DictionaryCounts;
import de.bsommerfeld.lexicon.core.domain.DictionarySet;
import de.bsommerfeld.lexicon.core.domain.DictionarySummary;
import de.bsommerfeld.lexicon.core.domain.FrequencyMode;
import de.bsommerfeld.lexicon.core.domain.KanjiEntry;
import de.bsommerfeld.lexicon.core.domain.KanjiMeta;
import de.bsommerfeld.lexicon.core.domain.KanjiMetaRecord;
import de.bsommerfeld.lexicon.core.domain.KanjiRecord;
import de.bsommerfeld.lexicon.core.domain.MatchSource;
import de.bsommerfeld.lexicon.core.domain.MatchType;
import de.bsommerfeld.lexicon.core.domain.MediaData;
import de.bsommerfeld.lexicon.core.domain.MediaEntry;
import de.bsommerfeld.lexicon.core.domain.MediaRequest;
import de.bsommerfeld.lexicon.core.domain.ObjectStore;
import de.bsommerfeld.lexicon.core.domain.SequenceQuery;
import de.bsommerfeld.lexicon.core.domain.Tag;
import de.bsommerfeld.lexicon.core.domain.TagQuery;
import de.bsommerfeld.lexicon.core.domain.TermEntry;
import de.bsommerfeld.lexicon.core.domain.TermMeta;
import de.bsommerfeld.lexicon.core.domain.TermMetaRecord;
import de.bsommerfeld.lexicon.core.domain.TermQuery;
import de.bsommerfeld.lexicon.core.domain.TermRecord;
import de.bsommerfeld.lexicon.core.util.TextUtils;
import de.bsommerfeld.lexicon.db.DatabaseStateException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQLite-backed {@link DictionaryDatabase}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader};
 * the schema comes from {@code schema.sql} and is applied by
 * {@link SqliteConnection} on every open.
 *
 * <h3>Lookup strategy</h3>
 * Every bulk lookup issues one query per input key, sequentially, and tags
 * each surviving row with the key's position. Dictionary-set membership is
 * tested per row after retrieval; the schema only indexes the dictionary
 * name. Prefix lookups are range scans ({@link PrefixRange}); suffix lookups
 * run the same range scan over the reversed shadow columns, which are written
 * together with every term and never recomputed at query time.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #bulkAdd} runs one transaction per call unless
 * {@code transactional-bulk-add} is disabled, in which case each row commits
 * on its own. {@link #deleteDictionary} always runs in one transaction.
 * Lookups use auto-commit.
 *
 * @see SqlLoader
 * @see SqliteConnection
 */
@Singleton
public class SqlDictionaryDatabase implements DictionaryDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDictionaryDatabase.class);

    private final SqliteConnection db;
    private final Path databaseFile;
    private final boolean transactionalBulkAdd;
    private final PayloadCodec codec = new PayloadCodec();

    private volatile boolean prepared;

    @Inject
    public SqlDictionaryDatabase(DatabaseConfig config) {
        this(new SqliteConnection(), config);
    }

    SqlDictionaryDatabase(SqliteConnection db, DatabaseConfig config) {
        this.db = db;
        this.databaseFile = config.resolveDatabaseFile();
        this.transactionalBulkAdd = config.isTransactionalBulkAdd();
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    @Override
    public void prepare() {
        db.open(databaseFile);
        prepared = true;
    }

    @Override
    public void close() {
        db.close();
        prepared = false;
    }

    @Override
    public boolean isPrepared() {
        return prepared;
    }

    /**
     * Closes the store if open, deletes the file and reopens it empty. A
     * deletion failure is logged and reported through the return value; the
     * store is reopened either way so callers are left with a usable handle.
     */
    @Override
    public boolean purge() {
        if (db.isOpening())
            throw new DatabaseStateException(Reason.PURGE_WHILE_OPENING, "Cannot purge database while opening");

        if (db.isOpen()) {
            db.close();
            prepared = false;
        }

        boolean deleted = false;
        try {
            db.deleteBackingStore(databaseFile);
            deleted = true;
            LOG.info("Purged dictionary database {}", databaseFile);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to delete dictionary database {}", databaseFile, e);
        }

        prepare();
        return deleted;
    }

    // =====================================================================
    // Term Lookups
    // =====================================================================

    @Override
    public List<TermEntry> findTermsBulk(List<String> terms, DictionarySet dictionaries, MatchType matchType) {
        return findTermsByColumn(TermColumn.EXPRESSION, terms, dictionaries, matchType);
    }

    @Override
    public List<TermEntry> findTermsByReadingBulk(List<String> readings, DictionarySet dictionaries,
            MatchType matchType) {
        return findTermsByColumn(TermColumn.READING, readings, dictionaries, matchType);
    }

    private List<TermEntry> findTermsByColumn(TermColumn column, List<String> queries,
            DictionarySet dictionaries, MatchType matchType) {
        if (queries.isEmpty())
            return Collections.emptyList();

        MatchType type = matchType == null ? MatchType.EXACT : matchType;
        Connection conn = db.getHandle();
        List<TermEntry> results = new ArrayList<>();
        try {
            for (int i = 0; i < queries.size(); i++) {
                String query = queries.get(i);
                if (query == null)
                    continue;
                try (PreparedStatement ps = prepareTermLookup(conn, column, query, type)) {
                    collectTerms(ps, i, type, column.source, dictionaries, results);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find terms by " + column.sqlName, e);
        }
        return results;
    }

    /**
     * Picks the statement for a match type. Suffix lookups reverse the query
     * and reuse the prefix path against the reversed column.
     */
    private PreparedStatement prepareTermLookup(Connection conn, TermColumn column, String query,
            MatchType matchType) throws SQLException {
        String base = "select-terms-by-" + column.sqlName;
        switch (matchType) {
            case PREFIX:
                return prepareRange(conn, base, query);
            case SUFFIX:
                return prepareRange(conn, base + "-reverse", TextUtils.reverse(query));
            case ANYWHERE:
                return prepare(conn, base + "-substring", query);
            case EXACT:
            default:
                return prepare(conn, base, query);
        }
    }

    private PreparedStatement prepareRange(Connection conn, String base, String prefix) throws SQLException {
        String upper = PrefixRange.upperBound(prefix);
        if (upper == null)
            return prepare(conn, base + "-from", prefix);
        return prepare(conn, base + "-range", prefix, upper);
    }

    @Override
    public List<TermEntry> findTermsExactBulk(List<TermQuery> queries, DictionarySet dictionaries) {
        if (queries.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<TermEntry> results = new ArrayList<>();
        try {
            for (int i = 0; i < queries.size(); i++) {
                TermQuery query = queries.get(i);
                if (query == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-terms-by-expression-and-reading",
                        query.term(), query.reading())) {
                    collectTerms(ps, i, MatchType.EXACT, MatchSource.TERM, dictionaries, results);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find terms by expression and reading", e);
        }
        return results;
    }

    @Override
    public List<TermEntry> findTermsBySequenceBulk(List<SequenceQuery> queries, DictionarySet dictionaries) {
        if (queries.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<TermEntry> results = new ArrayList<>();
        try {
            for (int i = 0; i < queries.size(); i++) {
                SequenceQuery query = queries.get(i);
                if (query == null)
                    continue;
                try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-terms-by-sequence"))) {
                    ps.setInt(1, query.sequence());
                    ps.setString(2, query.dictionary());
                    collectTerms(ps, i, MatchType.EXACT, MatchSource.SEQUENCE, dictionaries, results);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find terms by sequence", e);
        }
        return results;
    }

    private void collectTerms(PreparedStatement ps, int index, MatchType matchType, MatchSource source,
            DictionarySet dictionaries, List<TermEntry> out) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                if (dictionaries.has(rs.getString("dictionary")))
                    out.add(mapTerm(rs, index, matchType, source));
            }
        }
    }

    // =====================================================================
    // Kanji, Meta, Tag and Media Lookups
    // =====================================================================

    @Override
    public List<KanjiEntry> findKanjiBulk(List<String> characters, DictionarySet dictionaries) {
        if (characters.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<KanjiEntry> results = new ArrayList<>();
        try {
            for (int i = 0; i < characters.size(); i++) {
                if (characters.get(i) == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-kanji-by-character", characters.get(i));
                        ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        if (dictionaries.has(rs.getString("dictionary")))
                            results.add(mapKanji(rs, i));
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find kanji", e);
        }
        return results;
    }

    @Override
    public List<TermMeta> findTermMetaBulk(List<String> terms, DictionarySet dictionaries) {
        if (terms.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<TermMeta> results = new ArrayList<>();
        try {
            for (int i = 0; i < terms.size(); i++) {
                if (terms.get(i) == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-term-meta-by-term", terms.get(i));
                        ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String dictionary = rs.getString("dictionary");
                        if (dictionaries.has(dictionary)) {
                            results.add(new TermMeta(i, rs.getString("term"), rs.getString("mode"),
                                    codec.decodeTree(rs.getString("data"), "term_meta.data"), dictionary));
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find term meta", e);
        }
        return results;
    }

    @Override
    public List<KanjiMeta> findKanjiMetaBulk(List<String> characters, DictionarySet dictionaries) {
        if (characters.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<KanjiMeta> results = new ArrayList<>();
        try {
            for (int i = 0; i < characters.size(); i++) {
                if (characters.get(i) == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-kanji-meta-by-character", characters.get(i));
                        ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String dictionary = rs.getString("dictionary");
                        if (dictionaries.has(dictionary)) {
                            results.add(new KanjiMeta(i, rs.getString("character"), rs.getString("mode"),
                                    codec.decodeTree(rs.getString("data"), "kanji_meta.data"), dictionary));
                        }
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find kanji meta", e);
        }
        return results;
    }

    @Override
    public List<Tag> findTagMetaBulk(List<TagQuery> queries) {
        if (queries.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<Tag> results = new ArrayList<>();
        try {
            for (TagQuery query : queries) {
                if (query == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-tag-meta-by-name", query.name(),
                        query.dictionary());
                        ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        results.add(mapTag(rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find tag meta", e);
        }
        return results;
    }

    @Override
    public List<Tag> findTagForTitle(String titlePattern) {
        Connection conn = db.getHandle();
        List<Tag> results = new ArrayList<>();
        try (PreparedStatement ps = prepare(conn, "select-tag-meta-like-name", titlePattern);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                results.add(mapTag(rs));
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find tags matching " + titlePattern, e);
        }
        return results;
    }

    @Override
    public List<MediaEntry> getMedia(List<MediaRequest> requests) {
        if (requests.isEmpty())
            return Collections.emptyList();

        Connection conn = db.getHandle();
        List<MediaEntry> results = new ArrayList<>();
        try {
            for (int i = 0; i < requests.size(); i++) {
                MediaRequest request = requests.get(i);
                if (request == null)
                    continue;
                try (PreparedStatement ps = prepare(conn, "select-media", request.path(), request.dictionary());
                        ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        results.add(new MediaEntry(i, new MediaData(
                                rs.getString("dictionary"), rs.getString("path"),
                                rs.getString("media_type"), rs.getInt("width"),
                                rs.getInt("height"), rs.getBytes("content"))));
                    }
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to load media", e);
        }
        return results;
    }

    // =====================================================================
    // Aggregates
    // =====================================================================

    @Override
    public List<DictionarySummary> getDictionaryInfo() {
        Connection conn = db.getHandle();
        List<DictionarySummary> results = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-dictionaries"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                results.add(mapDictionary(rs));
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read dictionary info", e);
        }
        return results;
    }

    /**
     * Counts rows per content store for each dictionary. The total is
     * zero-initialised for every store so that it is complete even when no
     * dictionary was requested.
     */
    @Override
    public DictionaryCounts getDictionaryCounts(List<String> dictionaryNames, boolean includeTotal) {
        Connection conn = db.getHandle();
        List<DictionaryCountGroup> groups = new ArrayList<>();
        try {
            for (String dictionary : dictionaryNames) {
                Map<String, Integer> counts = new LinkedHashMap<>();
                for (ObjectStore<?> store : ObjectStore.CONTENT_STORES)
                    counts.put(store.name(), countRows(conn, store, dictionary));
                groups.add(new DictionaryCountGroup(dictionary, counts));
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count dictionary rows", e);
        }

        Map<String, Integer> total = null;
        if (includeTotal) {
            total = new LinkedHashMap<>();
            for (ObjectStore<?> store : ObjectStore.CONTENT_STORES)
                total.put(store.name(), 0);
            for (DictionaryCountGroup group : groups) {
                for (Map.Entry<String, Integer> entry : group.counts().entrySet())
                    total.merge(entry.getKey(), entry.getValue(), Integer::sum);
            }
        }
        return new DictionaryCounts(groups, total);
    }

    private int countRows(Connection conn, ObjectStore<?> store, String dictionary) throws SQLException {
        try (PreparedStatement ps = prepare(conn, "count-" + statementStem(store) + "-by-dictionary", dictionary);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    @Override
    public boolean dictionaryExists(String title) {
        Connection conn = db.getHandle();
        try (PreparedStatement ps = prepare(conn, "select-dictionary-exists", title);
                ResultSet rs = ps.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to check dictionary " + title, e);
        }
    }

    // =====================================================================
    // Mutation
    // =====================================================================

    @Override
    public <T> void bulkAdd(ObjectStore<T> store, List<T> items, int start, int count) {
        if (items.isEmpty() || count <= 0)
            return;
        if (start < 0)
            throw new IllegalArgumentException("start must not be negative: " + start);
        if (start >= items.size())
            return;

        int end = (int) Math.min((long) start + count, items.size());
        List<T> slice = items.subList(start, end);
        Connection conn = db.getHandle();

        try {
            if (transactionalBulkAdd) {
                conn.setAutoCommit(false);
                try {
                    insertRows(conn, store, slice);
                    conn.commit();
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                } finally {
                    conn.setAutoCommit(true);
                }
            } else {
                insertRows(conn, store, slice);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to add " + slice.size() + " rows to " + store, e);
        }
        LOG.debug("[DB] Added {} rows to {}.", slice.size(), store);
    }

    /**
     * Inserts rows one statement execution at a time, in slice order.
     */
    private void insertRows(Connection conn, ObjectStore<?> store, List<?> rows) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-" + insertStem(store)))) {
            for (Object row : rows) {
                bindRow(ps, row);
                ps.executeUpdate();
            }
        }
    }

    private void bindRow(PreparedStatement ps, Object row) throws SQLException {
        if (row instanceof DictionarySummary summary)
            bindDictionary(ps, summary);
        else if (row instanceof TermRecord term)
            bindTerm(ps, term);
        else if (row instanceof TermMetaRecord meta)
            bindMeta(ps, meta.dictionary(), meta.expression(), meta.mode(), codec.encode(meta.data()));
        else if (row instanceof KanjiRecord kanji)
            bindKanji(ps, kanji);
        else if (row instanceof KanjiMetaRecord meta)
            bindMeta(ps, meta.dictionary(), meta.character(), meta.mode(), codec.encode(meta.data()));
        else if (row instanceof Tag tag)
            bindTag(ps, tag);
        else if (row instanceof MediaData media)
            bindMedia(ps, media);
        else
            throw new IllegalArgumentException("Unsupported row type: " + row.getClass().getName());
    }

    /** Binds all 13 dictionary parameters; booleans are stored as 0/1. */
    private void bindDictionary(PreparedStatement ps, DictionarySummary d) throws SQLException {
        ps.setString(1, d.title());
        ps.setInt(2, d.version());
        ps.setString(3, d.revision());
        ps.setInt(4, d.sequenced() ? 1 : 0);
        ps.setString(5, d.author());
        ps.setString(6, d.url());
        ps.setString(7, d.description());
        ps.setString(8, d.attribution());
        ps.setString(9, d.frequencyMode() == null ? null : d.frequencyMode().value());
        ps.setInt(10, d.prefixWildcardsSupported() ? 1 : 0);
        ps.setString(11, d.styles());
        ps.setString(12, d.counts() == null ? null : codec.encode(d.counts()));
        ps.setString(13, d.yomitanVersion());
    }

    /**
     * Binds a term. The reversed columns are always derived here from
     * expression and reading.
     */
    private void bindTerm(PreparedStatement ps, TermRecord t) throws SQLException {
        ps.setString(1, t.dictionary());
        ps.setString(2, t.expression());
        ps.setString(3, t.reading());
        ps.setString(4, TextUtils.reverse(t.expression()));
        ps.setString(5, TextUtils.reverse(t.reading()));
        ps.setString(6, t.effectiveDefinitionTags());
        ps.setString(7, t.rules());
        ps.setInt(8, t.score());
        ps.setString(9, codec.encodeList(t.glossary()));
        if (t.sequence() != null)
            ps.setInt(10, t.sequence());
        else
            ps.setNull(10, Types.INTEGER);
        ps.setString(11, t.termTags());
    }

    private void bindMeta(PreparedStatement ps, String dictionary, String key, String mode, String data)
            throws SQLException {
        ps.setString(1, dictionary);
        ps.setString(2, key);
        ps.setString(3, mode);
        ps.setString(4, data);
    }

    private void bindKanji(PreparedStatement ps, KanjiRecord k) throws SQLException {
        ps.setString(1, k.dictionary());
        ps.setString(2, k.character());
        ps.setString(3, k.onyomi());
        ps.setString(4, k.kunyomi());
        ps.setString(5, k.tags());
        ps.setString(6, codec.encodeList(k.meanings()));
        ps.setString(7, k.stats() == null ? null : codec.encode(k.stats()));
    }

    private void bindTag(PreparedStatement ps, Tag tag) throws SQLException {
        ps.setString(1, tag.dictionary());
        ps.setString(2, tag.name());
        ps.setString(3, tag.category());
        ps.setInt(4, tag.order());
        ps.setString(5, tag.notes());
        ps.setInt(6, tag.score());
    }

    private void bindMedia(PreparedStatement ps, MediaData media) throws SQLException {
        ps.setString(1, media.dictionary());
        ps.setString(2, media.path());
        ps.setString(3, media.mediaType());
        ps.setInt(4, media.width());
        ps.setInt(5, media.height());
        ps.setBytes(6, media.content());
    }

    /**
     * Deletes a dictionary's rows from every content store, then the
     * dictionary row itself, in one transaction.
     */
    @Override
    public Map<String, Integer> deleteDictionary(String title) {
        Connection conn = db.getHandle();
        Map<String, Integer> deleted = new LinkedHashMap<>();
        try {
            conn.setAutoCommit(false);
            try {
                for (ObjectStore<?> store : ObjectStore.CONTENT_STORES) {
                    try (PreparedStatement ps = prepare(conn,
                            "delete-" + statementStem(store) + "-by-dictionary", title)) {
                        deleted.put(store.name(), ps.executeUpdate());
                    }
                }
                try (PreparedStatement ps = prepare(conn, "delete-dictionary", title)) {
                    deleted.put(ObjectStore.DICTIONARIES.name(), ps.executeUpdate());
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to delete dictionary " + title, e);
        }
        LOG.info("Deleted dictionary '{}': {}", title, deleted);
        return deleted;
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private TermEntry mapTerm(ResultSet rs, int index, MatchType matchType, MatchSource source)
            throws SQLException {
        return new TermEntry(
                index, matchType, source,
                rs.getString("expression"), rs.getString("reading"),
                TextUtils.splitTokens(rs.getString("definition_tags")),
                TextUtils.splitTokens(rs.getString("term_tags")),
                TextUtils.splitTokens(rs.getString("rules")),
                codec.decodeNodeList(rs.getString("glossary"), "terms.glossary"),
                rs.getInt("score"), rs.getString("dictionary"),
                rs.getLong("id"), rs.getInt("sequence"));
    }

    private KanjiEntry mapKanji(ResultSet rs, int index) throws SQLException {
        String stats = rs.getString("stats");
        return new KanjiEntry(
                index, rs.getString("character"),
                TextUtils.splitTokens(rs.getString("onyomi")),
                TextUtils.splitTokens(rs.getString("kunyomi")),
                TextUtils.splitTokens(rs.getString("tags")),
                codec.decodeStringList(rs.getString("meanings"), "kanji.meanings"),
                stats == null || stats.isEmpty()
                        ? Collections.emptyMap()
                        : codec.decodeStringMap(stats, "kanji.stats"),
                rs.getString("dictionary"));
    }

    private Tag mapTag(ResultSet rs) throws SQLException {
        return new Tag(rs.getString("name"), rs.getString("category"), rs.getInt("order_value"),
                rs.getString("notes"), rs.getInt("score"), rs.getString("dictionary"));
    }

    /**
     * Re-materializes a summary: integer flags become booleans, absent
     * revision and styles become empty strings.
     */
    private DictionarySummary mapDictionary(ResultSet rs) throws SQLException {
        String revision = rs.getString("revision");
        String styles = rs.getString("styles");
        String counts = rs.getString("counts");
        return new DictionarySummary(
                rs.getString("title"), rs.getInt("version"),
                revision == null ? "" : revision,
                rs.getInt("sequenced") != 0,
                rs.getString("author"), rs.getString("url"),
                rs.getString("description"), rs.getString("attribution"),
                FrequencyMode.fromValue(rs.getString("frequency_mode")),
                rs.getInt("prefix_wildcards_supported") == 1,
                styles == null ? "" : styles,
                counts == null || counts.isEmpty() ? null : codec.decodeTree(counts, "dictionaries.counts"),
                rs.getString("yomitan_version"));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private PreparedStatement prepare(Connection conn, String statement, String... params) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(SqlLoader.load(statement));
        try {
            for (int i = 0; i < params.length; i++)
                ps.setString(i + 1, params[i]);
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
        return ps;
    }

    /** SQL file stem of a store, e.g. {@code term-meta} for {@code term_meta}. */
    private static String statementStem(ObjectStore<?> store) {
        return store.tableName().replace('_', '-');
    }

    /** Insert statements are named after a single row, e.g. {@code insert-term}. */
    private static String insertStem(ObjectStore<?> store) {
        if (store == ObjectStore.DICTIONARIES)
            return "dictionary";
        if (store == ObjectStore.TERMS)
            return "term";
        return statementStem(store);
    }

    private enum TermColumn {
        EXPRESSION("expression", MatchSource.TERM),
        READING("reading", MatchSource.READING);

        private final String sqlName;
        private final MatchSource source;

        TermColumn(String sqlName, MatchSource source) {
            this.sqlName = sqlName;
            this.source = source;
        }
    }
}
