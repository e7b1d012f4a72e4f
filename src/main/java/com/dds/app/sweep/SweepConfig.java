package com.dds.app.sweep;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

import com.dds.app.config.Config;

/**
 * Settings of one sweep. Immutable for the lifetime of the session.
 */
public record SweepConfig(
        Path root,
        boolean recursive,
        boolean dryRun,
        boolean forceRefresh,
        Duration cacheWindow,
        Verbosity verbosity,
        int concurrencyLimit,
        Duration taskTimeout,
        Duration flushInterval,
        int flushThreshold,
        int deleteParallelism,
        String targetName,
        List<String> excludeGlobs
) {

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_FLUSH_THRESHOLD = 500;
    public static final int DEFAULT_DELETE_PARALLELISM = 16;

    public SweepConfig {
        Objects.requireNonNull(root, "root");
        root = root.toAbsolutePath().normalize();
        if (cacheWindow == null || cacheWindow.isNegative()) throw new IllegalArgumentException("cacheWindow must be >= 0");
        if (concurrencyLimit < 1) throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new IllegalArgumentException("taskTimeout must be > 0");
        }
        if (flushInterval == null || flushInterval.isNegative()) throw new IllegalArgumentException("flushInterval must be >= 0");
        if (flushThreshold < 1) throw new IllegalArgumentException("flushThreshold must be >= 1");
        if (deleteParallelism < 1) throw new IllegalArgumentException("deleteParallelism must be >= 1");
        if (targetName == null || targetName.isBlank()) throw new IllegalArgumentException("targetName is required");
        verbosity = verbosity == null ? Verbosity.NORMAL : verbosity;
        excludeGlobs = excludeGlobs == null ? List.of() : List.copyOf(excludeGlobs);
    }

    /**
     * Recursive, deleting, cache-respecting sweep with the defaults from {@link Config}.
     */
    public static SweepConfig defaults(Path root) {
        return new SweepConfig(
                root,
                true,
                false,
                false,
                Config.getCacheWindow(),
                Verbosity.NORMAL,
                Config.getConcurrency(),
                Config.getTaskTimeout(),
                DEFAULT_FLUSH_INTERVAL,
                DEFAULT_FLUSH_THRESHOLD,
                DEFAULT_DELETE_PARALLELISM,
                Config.getTargetName(),
                List.of()
        );
    }

    public SweepConfig withRecursive(boolean value) {
        return new SweepConfig(root, value, dryRun, forceRefresh, cacheWindow, verbosity, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withDryRun(boolean value) {
        return new SweepConfig(root, recursive, value, forceRefresh, cacheWindow, verbosity, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withForceRefresh(boolean value) {
        return new SweepConfig(root, recursive, dryRun, value, cacheWindow, verbosity, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withCacheWindow(Duration value) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, value, verbosity, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withVerbosity(Verbosity value) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, cacheWindow, value, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withConcurrency(int value) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, cacheWindow, verbosity, value,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withTaskTimeout(Duration value) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, cacheWindow, verbosity, concurrencyLimit,
                value, flushInterval, flushThreshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withFlush(Duration interval, int threshold) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, cacheWindow, verbosity, concurrencyLimit,
                taskTimeout, interval, threshold, deleteParallelism, targetName, excludeGlobs);
    }

    public SweepConfig withExcludeGlobs(List<String> value) {
        return new SweepConfig(root, recursive, dryRun, forceRefresh, cacheWindow, verbosity, concurrencyLimit,
                taskTimeout, flushInterval, flushThreshold, deleteParallelism, targetName, value);
    }

    /** Cache rows and unfinished sessions older than this are removed. */
    public Duration retentionHorizon() {
        return cacheWindow.multipliedBy(2);
    }
}
