package com.dds.app.queue;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.cache.CacheStatus;
import com.dds.app.cache.DirectoryCache;
import com.dds.app.database.SweepDao;
import com.dds.app.database.SweepDao.QueueCompletion;

/**
 * Durable per-session queue of directories.
 *
 * <p>A path has at most one row per session, so once it has been claimed it can never be
 * handed out again in that session. Claiming is a guarded {@code PENDING -> IN_PROGRESS}
 * update; a row another caller already claimed updates zero rows and is skipped.
 */
public final class WorkQueue {

    private static final Logger logger = LoggerFactory.getLogger(WorkQueue.class);

    public static final String CACHE_FRESH_NOTE = "cache-fresh";

    /** A claimed entry and the cache status it was routed with. */
    public record Claim(Path path, CacheStatus status) {}

    public record Dequeued(List<Claim> claimed, List<Path> resolvedFresh) {
        public boolean isEmpty() {
            return claimed.isEmpty() && resolvedFresh.isEmpty();
        }
    }

    private final Jdbi jdbi;
    private final DirectoryCache cache;
    private final Clock clock;

    public WorkQueue(Jdbi jdbi, DirectoryCache cache, Clock clock) {
        this.jdbi = jdbi;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Inserts pending entries; paths the session already knows are ignored. Returns how many were new.
     */
    public int enqueue(String sessionId, Collection<Path> paths) {
        if (paths.isEmpty()) return 0;
        List<String> keys = paths.stream().map(Path::toString).distinct().toList();
        int[] counts = jdbi.withExtension(SweepDao.class, dao -> dao.enqueue(sessionId, keys, clock.millis()));
        return sum(counts);
    }

    /**
     * Claims up to {@code limit} pending entries. Entries the cache reports fresh are completed
     * on the spot (never claimed) and returned in {@link Dequeued#resolvedFresh()}; freshness is
     * not checked again later in the session.
     */
    public synchronized Dequeued dequeueBatch(String sessionId, int limit) {
        List<Claim> claimed = new ArrayList<>();
        List<Path> fresh = new ArrayList<>();

        while (claimed.size() < limit) {
            int want = limit - claimed.size();
            List<String> candidates = jdbi.withExtension(SweepDao.class, dao -> dao.peekPending(sessionId, want));
            if (candidates.isEmpty()) break;

            List<String> freshKeys = new ArrayList<>();
            List<Claim> toClaim = new ArrayList<>();
            for (String key : candidates) {
                Path p = Path.of(key);
                CacheStatus status = cache.statusOf(p);
                if (status == CacheStatus.FRESH) freshKeys.add(key);
                else toClaim.add(new Claim(p, status));
            }

            List<String> claimKeys = toClaim.stream().map(c -> c.path().toString()).toList();
            int[][] results = jdbi.inTransaction(handle -> {
                SweepDao dao = handle.attach(SweepDao.class);
                int[] f = freshKeys.isEmpty() ? new int[0]
                        : dao.transitionEntries(sessionId, freshKeys, QueueState.PENDING.name(),
                                QueueState.COMPLETED.name(), CACHE_FRESH_NOTE);
                int[] c = claimKeys.isEmpty() ? new int[0]
                        : dao.transitionEntries(sessionId, claimKeys, QueueState.PENDING.name(),
                                QueueState.IN_PROGRESS.name(), null);
                return new int[][] {f, c};
            });

            for (int i = 0; i < results[0].length; i++) {
                if (results[0][i] == 1) fresh.add(Path.of(freshKeys.get(i)));
            }
            for (int i = 0; i < results[1].length; i++) {
                if (results[1][i] == 1) claimed.add(toClaim.get(i));
            }
        }

        if (!fresh.isEmpty()) logger.debug("Session {}: {} queued directories still fresh, skipped", sessionId, fresh.size());
        return new Dequeued(List.copyOf(claimed), List.copyOf(fresh));
    }

    /**
     * Moves a claimed entry to {@code COMPLETED} or {@code FAILED}. Returns false if it was not in progress.
     */
    public boolean complete(String sessionId, Path path, QueueState outcome, String note) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal queue state: " + outcome);
        }
        List<QueueCompletion> one = List.of(new QueueCompletion(path.toString(), outcome.name(), note));
        int[] counts = jdbi.withExtension(SweepDao.class, dao -> dao.completeEntries(sessionId, one));
        return sum(counts) == 1;
    }

    /**
     * Puts a claimed entry back to pending (its task was abandoned before producing a result).
     */
    public boolean release(String sessionId, Path path) {
        int[] counts = jdbi.withExtension(SweepDao.class, dao -> dao.transitionEntries(sessionId,
                List.of(path.toString()), QueueState.IN_PROGRESS.name(), QueueState.PENDING.name(), null));
        return sum(counts) == 1;
    }

    public long pendingCount(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.countQueueState(sessionId, QueueState.PENDING.name()));
    }

    public long countInState(String sessionId, QueueState state) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.countQueueState(sessionId, state.name()));
    }

    /** Pending plus in-progress entries. */
    public long openCount(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.countOpenEntries(sessionId));
    }

    public List<QueueEntry> incompleteEntries(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.fetchOpenEntries(sessionId))
                .stream().map(QueueEntry::from).toList();
    }

    public Optional<QueueEntry> find(String sessionId, Path path) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.findQueueEntry(sessionId, path.toString()))
                .map(QueueEntry::from);
    }

    public QueueState stateOf(String sessionId, Path path) {
        return find(sessionId, path).map(QueueEntry::state).orElse(null);
    }

    /**
     * Applies {@link ResumePlan#reconcile} to the session's persisted entries.
     */
    public ResumePlan resume(String sessionId) {
        ResumePlan plan = ResumePlan.reconcile(incompleteEntries(sessionId));
        if (!plan.toReset().isEmpty()) {
            List<String> keys = plan.toReset().stream().map(Path::toString).toList();
            jdbi.useTransaction(handle -> handle.attach(SweepDao.class).transitionEntries(sessionId, keys,
                    QueueState.IN_PROGRESS.name(), QueueState.PENDING.name(), null));
        }
        logger.info("Session {}: resuming {} queued directories ({} were in progress)",
                sessionId, plan.resumableCount(), plan.toReset().size());
        return plan;
    }

    private static int sum(int[] counts) {
        int total = 0;
        for (int c : counts) total += c;
        return total;
    }
}
