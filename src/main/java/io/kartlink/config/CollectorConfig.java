package io.kartlink.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CollectorConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "kartlink.db";
    public static final String SETTINGS_FILE_NAME = "kartlink-settings.json";

    private final Path rootDir;
    private final Path dbFileOverride;

    public CollectorConfig(Path rootDir, Path dbFileOverride) {
        this.rootDir = rootDir;
        this.dbFileOverride = dbFileOverride;
    }

    public static CollectorConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new CollectorConfig(resolved.toAbsolutePath().normalize(), null);
    }

    public CollectorConfig withDbFile(String dbFile) {
        if (dbFile == null || dbFile.isBlank()) {
            return this;
        }
        return new CollectorConfig(rootDir, Paths.get(dbFile).toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return dbFileOverride != null ? dbFileOverride : rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
