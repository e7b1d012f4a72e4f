package com.dds.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Central configuration for dds.
 * Resolves the cache database location and the sweep defaults from
 * system properties, the environment and a local {@code .env} file, in that order.
 */
public final class Config {

    private static final String APP_DIR = ".dds";
    private static final String DEFAULT_DB_NAME = "cache.sqlite";

    public static final long DEFAULT_CACHE_WINDOW_HOURS = 24;
    public static final int DEFAULT_CONCURRENCY = 100;
    public static final long DEFAULT_TASK_TIMEOUT_SECONDS = 30;
    public static final String DEFAULT_TARGET_NAME = ".DS_Store";

    // Environment variables
    private static final String ENV_DATA_DIR = "DDS_DATA_DIR";
    private static final String ENV_DB_NAME = "DDS_DB_NAME";
    private static final String ENV_CACHE_WINDOW_HOURS = "DDS_CACHE_WINDOW_HOURS";
    private static final String ENV_CONCURRENCY = "DDS_CONCURRENCY";
    private static final String ENV_TASK_TIMEOUT_SECONDS = "DDS_TASK_TIMEOUT_SECONDS";
    private static final String ENV_TARGET_NAME = "DDS_TARGET_NAME";

    // System property overrides (useful for tests/CI)
    private static final String PROP_DATA_DIR = "dds.dataDir";
    private static final String PROP_DB_NAME = "dds.dbName";
    private static final String PROP_CACHE_WINDOW_HOURS = "dds.cacheWindowHours";
    private static final String PROP_CONCURRENCY = "dds.concurrency";
    private static final String PROP_TASK_TIMEOUT_SECONDS = "dds.taskTimeoutSeconds";
    private static final String PROP_TARGET_NAME = "dds.targetName";

    // Logger must be initialized before any static initializer that may use it
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Config.class);
    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    private static volatile String cachedDbPathKey;
    private static volatile Path cachedDbPath;

    private Config() {}

    public static String getDbUrl() {
        return jdbcUrlFor(getDbFilePath());
    }

    public static String jdbcUrlFor(Path dbFile) {
        return "jdbc:sqlite:" + dbFile.toAbsolutePath();
    }

    /**
     * Path of the cache database file. The parent directory is created on first use.
     */
    public static Path getDbFilePath() {
        String dbFileName = resolveDbFileName();
        String overrideDir = getEnvOrDotenv(ENV_DATA_DIR);

        String key = (overrideDir == null ? "" : overrideDir) + "|" + dbFileName;
        Path current = cachedDbPath;
        if (current != null && key.equals(cachedDbPathKey)) {
            return current;
        }

        synchronized (Config.class) {
            current = cachedDbPath;
            if (current != null && key.equals(cachedDbPathKey)) {
                return current;
            }
            Path resolved = resolveDbPath(overrideDir, dbFileName);
            cachedDbPathKey = key;
            cachedDbPath = resolved;
            return resolved;
        }
    }

    public static Duration getCacheWindow() {
        return Duration.ofHours(getLong(ENV_CACHE_WINDOW_HOURS, DEFAULT_CACHE_WINDOW_HOURS, 0));
    }

    public static int getConcurrency() {
        return (int) Math.min(Integer.MAX_VALUE, getLong(ENV_CONCURRENCY, DEFAULT_CONCURRENCY, 1));
    }

    public static Duration getTaskTimeout() {
        return Duration.ofSeconds(getLong(ENV_TASK_TIMEOUT_SECONDS, DEFAULT_TASK_TIMEOUT_SECONDS, 1));
    }

    public static String getTargetName() {
        String v = getEnvOrDotenv(ENV_TARGET_NAME);
        return v == null ? DEFAULT_TARGET_NAME : v;
    }

    // --- Resolution ---

    private static String resolveDbFileName() {
        String name = getEnvOrDotenv(ENV_DB_NAME);
        return name == null ? DEFAULT_DB_NAME : name;
    }

    private static long getLong(String envKey, long fallback, long min) {
        String v = getEnvOrDotenv(envKey);
        if (v == null) return fallback;
        try {
            return Math.max(min, Long.parseLong(v));
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: '{}' (using {})", envKey, v, fallback);
            return fallback;
        }
    }

    /**
     * System property first, then the process environment, then the {@code .env} file.
     */
    private static String getEnvOrDotenv(String key) {
        String propKey = mapToSystemPropertyKey(key);
        if (propKey != null) {
            String propVal = System.getProperty(propKey);
            if (propVal != null && !propVal.isBlank()) {
                return propVal.trim();
            }
        }

        String envVal = System.getenv(key);
        if (envVal != null && !envVal.isBlank()) {
            return envVal.trim();
        }

        String fileVal = dotenv.get(key);
        if (fileVal == null || fileVal.isBlank()) {
            return null;
        }
        return fileVal.trim();
    }

    private static String mapToSystemPropertyKey(String envKey) {
        if (envKey == null) return null;
        return switch (envKey) {
            case ENV_DATA_DIR -> PROP_DATA_DIR;
            case ENV_DB_NAME -> PROP_DB_NAME;
            case ENV_CACHE_WINDOW_HOURS -> PROP_CACHE_WINDOW_HOURS;
            case ENV_CONCURRENCY -> PROP_CONCURRENCY;
            case ENV_TASK_TIMEOUT_SECONDS -> PROP_TASK_TIMEOUT_SECONDS;
            case ENV_TARGET_NAME -> PROP_TARGET_NAME;
            default -> null;
        };
    }

    private static Path resolveDbPath(String overrideDir, String dbFileName) {
        Path dataDir = overrideDir != null
                ? Paths.get(overrideDir)
                : Paths.get(System.getProperty("user.home"), APP_DIR);

        try {
            if (!Files.exists(dataDir)) {
                Files.createDirectories(dataDir);
            }
            logger.debug("Cache database located in: {}", dataDir.toAbsolutePath());
            return dataDir.resolve(dbFileName);
        } catch (IOException e) {
            // Fallback: working directory
            Path localPath = Paths.get(dbFileName).toAbsolutePath();
            logger.warn("Cannot use {}; falling back to {}", dataDir, localPath);
            return localPath;
        }
    }
}
