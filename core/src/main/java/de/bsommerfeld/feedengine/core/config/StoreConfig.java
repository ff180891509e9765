package de.bsommerfeld.feedengine.core.config;

import de.bsommerfeld.feedengine.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location of the SQLite database. An empty path means the platform's
 * application data directory.
 */
public class StoreConfig {

    public static final String DEFAULT_FILE_NAME = "feeds.db";

    private String path = "";

    public StoreConfig() {
    }

    public StoreConfig(Path path) {
        this.path = path.toAbsolutePath().toString();
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path == null ? "" : path;
    }

    /** Returns the configured file, or {@code {appData}/feeds.db} when unset. */
    public Path resolvePath() {
        if (path == null || path.isBlank()) {
            return StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve(DEFAULT_FILE_NAME);
        }
        return Paths.get(path).toAbsolutePath();
    }
}
