package de.bsommerfeld.lexicon.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL from classpath resources.
 *
 * <p>
 * Single statements live under {@code sql/} and follow the naming convention
 * {@code sql/<operation>-<entity>[-by-<column>].sql}, e.g.
 * {@code insert-term.sql}, {@code select-terms-by-expression-range.sql}.
 * Multi-statement scripts such as {@code schema.sql} live at the classpath
 * root and are returned pre-split by {@link #loadScript(String)}.
 *
 * <p>
 * Each resource is read exactly once and cached for the lifetime of the JVM.
 *
 * @see SqliteConnection
 * @see SqlDictionaryDatabase
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @param name the file stem without path prefix or extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent("sql/" + name + ".sql", SqlLoader::readResource);
    }

    /**
     * Returns the statements of a root-level script {@code <name>.sql}, split
     * on semicolons that end a line. Blank fragments are dropped.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String name) {
        String script = CACHE.computeIfAbsent(name + ".sql", SqlLoader::readResource);
        List<String> statements = new ArrayList<>();
        for (String sql : script.split(";\\s*(\\r?\\n|$)")) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty())
                statements.add(trimmed);
        }
        return Collections.unmodifiableList(statements);
    }

    private static String readResource(String path) {
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
