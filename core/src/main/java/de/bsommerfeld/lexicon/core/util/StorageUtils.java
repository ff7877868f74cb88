package de.bsommerfeld.lexicon.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user data directory that holds the dictionary store and
 * its configuration. Paths are absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "lexicon-store";

    private StorageUtils() {
    }

    /** Data directory of this application. */
    public static Path getAppDataDir() {
        return getAppDataDir(APP_NAME);
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin"))
            return Paths.get(home, "Library", "Application Support", appName).toAbsolutePath();

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName).toAbsolutePath()
                    : Paths.get(home, "AppData", "Roaming", appName).toAbsolutePath();
        }

        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName).toAbsolutePath()
                : Paths.get(home, ".local", "share", appName).toAbsolutePath();
    }

    /** Location of {@code config.toml} inside the data directory. */
    public static Path getConfigFile() {
        return getAppDataDir().resolve("config.toml");
    }
}
