package com.dds.app.cache;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.database.Database.CacheRow;
import com.dds.app.database.Database.CacheStatsRow;
import com.dds.app.database.SweepDao;
import com.dds.app.database.SweepDao.CacheUpdate;
import com.dds.app.database.SweepDao.FreshEntry;

/**
 * Per-directory scan freshness backed by {@code directory_cache}.
 *
 * <p>Reads never fail the caller: a storage error is logged and the directory is reported
 * {@link CacheStatus#NOT_CACHED}, which only costs a redundant scan. Force refresh bypasses
 * reads but not writes.
 */
public final class DirectoryCache {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryCache.class);
    private static final int PRUNE_CHUNK = 10_000;

    private final Jdbi jdbi;
    private final Duration window;
    private final boolean forceRefresh;
    private final Clock clock;

    // Accelerator only: path -> last_searched of entries known complete
    private final Map<String, Long> freshIndex = new ConcurrentHashMap<>();

    public DirectoryCache(Jdbi jdbi, Duration window, boolean forceRefresh, Clock clock) {
        this.jdbi = jdbi;
        this.window = window;
        this.forceRefresh = forceRefresh;
        this.clock = clock;
    }

    /**
     * Rebuilds the in-memory index of fresh, completed directories. Empty in force mode.
     */
    public int loadFreshIndex() {
        freshIndex.clear();
        if (forceRefresh) return 0;
        long cutoff = clock.millis() - window.toMillis();
        try {
            List<FreshEntry> fresh = jdbi.withExtension(SweepDao.class, dao -> dao.fetchFreshComplete(cutoff));
            for (FreshEntry e : fresh) freshIndex.put(e.path(), e.lastSearched());
            logger.debug("Loaded {} fresh directories into the cache index", fresh.size());
            return fresh.size();
        } catch (JdbiException e) {
            logger.warn("Could not load the fresh-directory index; every directory will be rescanned", e);
            return 0;
        }
    }

    public CacheStatus statusOf(Path dir) {
        if (forceRefresh) return CacheStatus.NOT_CACHED;

        String key = dir.toString();
        long now = clock.millis();
        Long indexed = freshIndex.get(key);
        if (indexed != null) {
            if (now - indexed < window.toMillis()) return CacheStatus.FRESH;
            freshIndex.remove(key, indexed);
        }

        Optional<CacheRow> row;
        try {
            row = jdbi.withExtension(SweepDao.class, dao -> dao.findCacheEntry(key));
        } catch (JdbiException e) {
            logger.warn("Cache lookup failed for {}; treating as not cached", dir, e);
            return CacheStatus.NOT_CACHED;
        }

        CacheStatus status = row.map(r -> classify(r, now, window)).orElse(CacheStatus.NOT_CACHED);
        if (status == CacheStatus.FRESH) freshIndex.put(key, row.get().lastSearched());
        return status;
    }

    static CacheStatus classify(CacheRow row, long nowMillis, Duration window) {
        if (nowMillis - row.lastSearched() >= window.toMillis()) return CacheStatus.STALE;
        return row.completed() ? CacheStatus.FRESH : CacheStatus.INCOMPLETE;
    }

    public void recordResult(String sessionId, Path dir, boolean completed, String error, boolean matchFound) {
        recordResults(List.of(new CacheUpdate(dir.toString(), clock.millis(), completed, error, matchFound, sessionId)));
    }

    /**
     * Upserts scan results in one transaction. Returns false (and logs) when the write was dropped.
     */
    public boolean recordResults(List<CacheUpdate> updates) {
        if (updates.isEmpty()) return true;
        int[] applied;
        try {
            applied = jdbi.inTransaction(handle -> handle.attach(SweepDao.class).upsertCacheEntries(updates));
        } catch (JdbiException e) {
            logger.warn("Dropped {} cache updates after a storage error", updates.size(), e);
            return false;
        }
        for (int i = 0; i < updates.size(); i++) {
            // zero means a newer row was already there
            if (i < applied.length && applied[i] == 0) continue;
            CacheUpdate u = updates.get(i);
            if (u.completed()) freshIndex.put(u.path(), u.lastSearched());
            else freshIndex.remove(u.path());
        }
        return true;
    }

    /**
     * Direct children of {@code dir} that have a cache row of their own.
     */
    public List<Path> cachedChildren(Path dir) {
        String base = dir.toString();
        String sep = dir.getFileSystem().getSeparator();
        String lo = base.endsWith(sep) ? base : base + sep;
        String hi = lo.substring(0, lo.length() - 1) + (char) (lo.charAt(lo.length() - 1) + 1);

        List<String> descendants;
        try {
            descendants = jdbi.withExtension(SweepDao.class, dao -> dao.fetchCachedDescendants(lo, hi));
        } catch (JdbiException e) {
            logger.warn("Could not read cached children of {}", dir, e);
            return List.of();
        }

        List<Path> out = new ArrayList<>();
        for (String p : descendants) {
            String rest = p.substring(lo.length());
            if (!rest.isEmpty() && !rest.contains(sep)) out.add(dir.resolve(rest));
        }
        return out;
    }

    /**
     * Deletes rows last searched before {@code olderThan}, in chunks so other writers get a turn.
     */
    public int prune(Instant olderThan) {
        long cutoff = olderThan.toEpochMilli();
        int total = 0;
        while (true) {
            int removed = jdbi.withExtension(SweepDao.class, dao -> dao.pruneCacheChunk(cutoff, PRUNE_CHUNK));
            total += removed;
            if (removed < PRUNE_CHUNK) break;
        }
        if (total > 0) logger.info("Pruned {} cache entries older than {}", total, olderThan);
        return total;
    }

    public CacheStats stats() {
        CacheStatsRow row = jdbi.withExtension(SweepDao.class, SweepDao::fetchCacheStats);
        return new CacheStats(row.total(), row.completed(), row.total() - row.completed(), row.withMatches(), row.errors());
    }

    public List<String> incompletePaths() {
        return jdbi.withExtension(SweepDao.class, SweepDao::fetchIncompleteCachePaths);
    }

    public int clearIncomplete() {
        return jdbi.withExtension(SweepDao.class, SweepDao::deleteIncompleteCacheEntries);
    }
}
