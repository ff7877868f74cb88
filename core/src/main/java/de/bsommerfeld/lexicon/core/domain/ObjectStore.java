package de.bsommerfeld.lexicon.core.domain;

import java.util.List;

/**
 * Typed handle for one of the seven persisted stores. The type parameter is
 * the insert shape the store accepts, which lets
 * {@code bulkAdd(ObjectStore<T>, List<T>, int, int)} reject mismatched batches
 * at compile time.
 *
 * @param <T> insert shape of the store
 */
public final class ObjectStore<T> {

    public static final ObjectStore<DictionarySummary> DICTIONARIES =
            new ObjectStore<>("dictionaries", "dictionaries", DictionarySummary.class);
    public static final ObjectStore<TermRecord> TERMS =
            new ObjectStore<>("terms", "terms", TermRecord.class);
    public static final ObjectStore<TermMetaRecord> TERM_META =
            new ObjectStore<>("termMeta", "term_meta", TermMetaRecord.class);
    public static final ObjectStore<KanjiRecord> KANJI =
            new ObjectStore<>("kanji", "kanji", KanjiRecord.class);
    public static final ObjectStore<KanjiMetaRecord> KANJI_META =
            new ObjectStore<>("kanjiMeta", "kanji_meta", KanjiMetaRecord.class);
    public static final ObjectStore<Tag> TAG_META =
            new ObjectStore<>("tagMeta", "tag_meta", Tag.class);
    public static final ObjectStore<MediaData> MEDIA =
            new ObjectStore<>("media", "media", MediaData.class);

    /** The six stores whose rows are scoped to a dictionary, in count order. */
    public static final List<ObjectStore<?>> CONTENT_STORES =
            List.of(TERMS, KANJI, TERM_META, KANJI_META, TAG_META, MEDIA);

    private final String name;
    private final String tableName;
    private final Class<T> itemType;

    private ObjectStore(String name, String tableName, Class<T> itemType) {
        this.name = name;
        this.tableName = tableName;
        this.itemType = itemType;
    }

    /** Store key as used in count maps, e.g. {@code termMeta}. */
    public String name() {
        return name;
    }

    /** Backing SQL table, e.g. {@code term_meta}. */
    public String tableName() {
        return tableName;
    }

    public Class<T> itemType() {
        return itemType;
    }

    @Override
    public String toString() {
        return name;
    }
}
