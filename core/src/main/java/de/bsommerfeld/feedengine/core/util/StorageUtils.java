package de.bsommerfeld.feedengine.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Locates the engine's per-user data directory, which holds the SQLite store,
 * the transcript cache and {@code config.yml}. Nothing here creates
 * directories.
 *
 * <ul>
 * <li>macOS: {@code ~/Library/Application Support/{appName}}</li>
 * <li>Windows: {@code %APPDATA%\{appName}}, else {@code ~/AppData/Roaming/{appName}}</li>
 * <li>Everything else: {@code $XDG_DATA_HOME/{appName}}, else {@code ~/.local/share/{appName}}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "feed-engine";
    public static final String CONFIG_FILE_NAME = "config.yml";

    private StorageUtils() {
    }

    /** Absolute data directory for {@code appName} on the running platform. */
    public static Path getAppDataDir(String appName) {
        return resolveAppDataDir(System.getProperty("os.name", "generic"), System.getProperty("user.home"),
                System.getenv("APPDATA"), System.getenv("XDG_DATA_HOME"), appName);
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve(CONFIG_FILE_NAME);
    }

    static Path resolveAppDataDir(String osName, String userHome, String appData, String xdgDataHome,
            String appName) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path base;
        if (os.contains("mac") || os.contains("darwin")) {
            base = Paths.get(userHome, "Library", "Application Support");
        } else if (os.contains("win")) {
            base = isSet(appData) ? Paths.get(appData) : Paths.get(userHome, "AppData", "Roaming");
        } else {
            base = isSet(xdgDataHome) ? Paths.get(xdgDataHome) : Paths.get(userHome, ".local", "share");
        }
        return base.resolve(appName).toAbsolutePath();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
