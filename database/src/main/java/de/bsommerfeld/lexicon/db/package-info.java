/**
 * Persistence layer for imported dictionaries, backed by a single SQLite file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Importer / Translator / Display]
 *        │
 *        ▼
 *   DictionaryDatabase     ← interface, bound via DatabaseModule
 *        │
 *        ▼
 *   SqlDictionaryDatabase  ← lookups, counts, bulk insert, delete
 *        │
 *        ▼
 *   SqliteConnection       ← single handle, single-flight open, schema
 * </pre>
 *
 * <h2>Tables</h2>
 * Every content row carries the title of its dictionary in a
 * {@code dictionary} column; there are no foreign keys.
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ dictionaries (one row per imported dictionary)                   │
 * ├──────────────────────────┬────────────────────────────────────────┤
 * │ title (PK)               │ Dictionary title                      │
 * │ sequenced                │ 0/1                                   │
 * │ prefix_wildcards_supported│ 0/1                                  │
 * │ counts                   │ JSON, importer-provided               │
 * └──────────────────────────┴────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ terms                                                            │
 * ├──────────────────────────┬────────────────────────────────────────┤
 * │ expression / reading     │ Indexed, exact and prefix lookups     │
 * │ expression_reverse       │ Code-point reversal, suffix lookups   │
 * │ reading_reverse          │ Code-point reversal, suffix lookups   │
 * │ definition_tags, rules,  │ Space-separated tokens                │
 * │ term_tags                │                                       │
 * │ glossary                 │ JSON array                            │
 * │ sequence                 │ Nullable, read back as 0              │
 * └──────────────────────────┴────────────────────────────────────────┘
 * </pre>
 *
 * {@code term_meta}, {@code kanji}, {@code kanji_meta}, {@code tag_meta} and
 * {@code media} follow the same pattern: a surrogate {@code id}, the
 * {@code dictionary} column and the lookup key, each indexed. Opaque payloads
 * ({@code data}, {@code meanings}, {@code stats}) are stored as JSON text and
 * decoded by {@link PayloadCodec}; media content is a BLOB.
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link SqlLoader}; the DDL is {@code schema.sql}.
 * <ul>
 * <li>{@code insert-dictionary}, {@code insert-term},
 * {@code insert-term-meta}, {@code insert-kanji}, {@code insert-kanji-meta},
 * {@code insert-tag-meta}, {@code insert-media}</li>
 * <li>{@code select-terms-by-{expression|reading}} with the suffixes
 * {@code -range}, {@code -from}, {@code -reverse-range},
 * {@code -reverse-from} and {@code -substring}</li>
 * <li>{@code select-terms-by-expression-and-reading},
 * {@code select-terms-by-sequence}</li>
 * <li>{@code select-term-meta-by-term}, {@code select-kanji-by-character},
 * {@code select-kanji-meta-by-character}</li>
 * <li>{@code select-tag-meta-by-name}, {@code select-tag-meta-like-name},
 * {@code select-media}</li>
 * <li>{@code select-all-dictionaries}, {@code select-dictionary-exists},
 * {@code delete-dictionary}</li>
 * <li>{@code count-<store>-by-dictionary} and
 * {@code delete-<store>-by-dictionary} for each content store</li>
 * </ul>
 */
package de.bsommerfeld.lexicon.db;
