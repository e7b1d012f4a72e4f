package com.dds.app.sweep;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.cache.CacheStatus;
import com.dds.app.cache.DirectoryCache;
import com.dds.app.database.Database;
import com.dds.app.database.SweepDao;
import com.dds.app.database.SweepDao.CacheUpdate;
import com.dds.app.database.SweepDao.SessionCounters;
import com.dds.app.ledger.FoundFilesLedger;
import com.dds.app.queue.QueueState;
import com.dds.app.queue.ResumePlan;
import com.dds.app.queue.WorkQueue;
import com.dds.app.queue.WorkQueue.Claim;
import com.dds.app.queue.WorkQueue.Dequeued;
import com.dds.app.session.SessionFailedException;
import com.dds.app.session.SessionRegistry;
import com.dds.app.session.SessionRegistry.SessionStart;
import com.dds.app.session.SessionStatus;
import com.dds.app.sweep.WalkResult.Anomaly;

/**
 * Runs one sweep session.
 *
 * <p>A single coordinator thread (the caller of {@link #run}) owns all durable writes. Directory
 * scans run on a worker pool, at most {@code concurrencyLimit} at a time, each with its own
 * deadline. Their results are buffered and written in one transaction per flush, when the
 * buffer reaches {@code flushThreshold} outcomes or {@code flushInterval} has elapsed.
 */
public final class SweepOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SweepOrchestrator.class);

    public static final String TIMEOUT_NOTE = "timeout";

    private static final long MAX_POLL_NS = TimeUnit.MILLISECONDS.toNanos(100);
    private static final long MIN_POLL_NS = TimeUnit.MILLISECONDS.toNanos(1);
    // pending work exhausted but children are sitting in the buffer
    private static final long STARVED_FLUSH_LATENCY_NS = TimeUnit.MILLISECONDS.toNanos(250);

    private final Jdbi jdbi;
    private final Clock clock;
    private final Function<SweepConfig, DirectoryScanner> scannerFactory;

    public SweepOrchestrator(Database db) {
        this(db.jdbi(), Clock.systemUTC(), DirectoryWalker::forConfig);
    }

    SweepOrchestrator(Jdbi jdbi, Clock clock, Function<SweepConfig, DirectoryScanner> scannerFactory) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.scannerFactory = scannerFactory;
    }

    public SweepResult run(SweepConfig cfg, CancellationToken token) {
        return run(cfg, token, new SweepStats());
    }

    /**
     * Runs (or resumes) the session for {@code cfg} until the queue is drained or {@code token}
     * is cancelled.
     *
     * @throws IllegalArgumentException if the root is not a directory
     * @throws SessionFailedException if session bookkeeping could not be persisted
     */
    public SweepResult run(SweepConfig cfg, CancellationToken token, SweepStats stats) {
        if (!Files.isDirectory(cfg.root())) {
            throw new IllegalArgumentException("Not a directory: " + cfg.root());
        }

        DirectoryCache cache = new DirectoryCache(jdbi, cfg.cacheWindow(), cfg.forceRefresh(), clock);
        WorkQueue queue = new WorkQueue(jdbi, cache, clock);
        SessionRegistry sessions = new SessionRegistry(jdbi, clock);
        FoundFilesLedger ledger = new FoundFilesLedger(jdbi, clock);

        SessionStart start;
        try {
            sessions.cleanupStale(clock.instant().minus(cfg.retentionHorizon()));
            start = sessions.start(cfg.root(), cfg.recursive(), cfg.forceRefresh(), cfg.dryRun());
        } catch (RuntimeException e) {
            throw new SessionFailedException(null, "Could not start a session for " + cfg.root() + ": " + safeMsg(e), e);
        }

        String sessionId = start.session().id();
        stats.startedAtNanos = System.nanoTime();
        boolean interruptedWhileWaiting = false;

        try {
            Set<Path> resumedPaths = new HashSet<>();
            if (start.resumed()) {
                stats.seed(start.session());
                ResumePlan plan = queue.resume(sessionId);
                resumedPaths.addAll(plan.alreadyPending());
                resumedPaths.addAll(plan.toReset());
            } else {
                queue.enqueue(sessionId, List.of(cfg.root()));
            }
            int fresh = cache.loadFreshIndex();
            stats.queueDepth.set(queue.pendingCount(sessionId));
            logger.debug("Session {}: {} fresh directories indexed, {} queued", sessionId, fresh, stats.queueDepth.get());

            ScanLoop loop = new ScanLoop(cfg, sessionId, token, stats, cache, queue, resumedPaths,
                    scannerFactory.apply(cfg));
            loop.run();
            interruptedWhileWaiting = loop.interrupted;

            new FileDeleter(ledger, cfg.deleteParallelism()).deleteAll(sessionId, cfg.dryRun(), token, stats);

            boolean workLeft = queue.openCount(sessionId) > 0 || !ledger.pendingDeletion(sessionId).isEmpty();
            sessions.recordCounters(sessionId, stats.toCounters());

            SessionStatus status;
            if (workLeft) {
                sessions.markInterrupted(sessionId);
                status = SessionStatus.INTERRUPTED;
                logger.info("Session {} interrupted; run again to resume", sessionId);
            } else {
                sessions.markCompleted(sessionId);
                status = SessionStatus.COMPLETED;
                logger.info("Session {} completed", sessionId);
            }
            return new SweepResult(sessionId, status, start.resumed(), stats.snapshot());
        } catch (SessionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            markFailed(sessions, sessionId, e);
            throw new SessionFailedException(sessionId, "Session " + sessionId + " failed: " + safeMsg(e), e);
        } finally {
            if (interruptedWhileWaiting) Thread.currentThread().interrupt();
        }
    }

    private static void markFailed(SessionRegistry sessions, String sessionId, RuntimeException cause) {
        logger.error("Session {} failed", sessionId, cause);
        try {
            sessions.markFailed(sessionId);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            logger.error("Could not record failure of session {}: {}", sessionId, safeMsg(e));
        }
    }

    private static String safeMsg(Throwable t) {
        return (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName()
                : t.getMessage();
    }

    private record LiveTask(long id, Path dir, CancellationToken token, Future<?> future, long deadlineNs) {}

    private record TaskResult(long taskId, WalkResult result) {}

    /**
     * Coordinator state of one session. Everything here is touched by the coordinator thread only,
     * except {@code results}, which workers append to.
     */
    private final class ScanLoop {

        private final SweepConfig cfg;
        private final String sessionId;
        private final CancellationToken token;
        private final SweepStats stats;
        private final DirectoryCache cache;
        private final WorkQueue queue;
        private final Set<Path> resumedPaths;
        private final DirectoryScanner scanner;

        private final Map<Path, LiveTask> live = new HashMap<>();
        private final BlockingQueue<TaskResult> results = new LinkedBlockingQueue<>();
        private final WriteBuffer buffer = new WriteBuffer();
        private final long timeoutNs;
        private final long flushIntervalNs;

        private long taskSeq;
        private long lastFlushNs = System.nanoTime();
        // set by a flush; an exhausted queue is only polled again after one
        private boolean queueChanged = true;
        private boolean interrupted;

        ScanLoop(SweepConfig cfg, String sessionId, CancellationToken token, SweepStats stats,
                 DirectoryCache cache, WorkQueue queue, Set<Path> resumedPaths, DirectoryScanner scanner) {
            this.cfg = cfg;
            this.sessionId = sessionId;
            this.token = token;
            this.stats = stats;
            this.cache = cache;
            this.queue = queue;
            this.resumedPaths = resumedPaths;
            this.scanner = scanner;
            this.timeoutNs = cfg.taskTimeout().toNanos();
            this.flushIntervalNs = cfg.flushInterval().toNanos();
        }

        void run() {
            ExecutorService workers = Executors.newCachedThreadPool(FileDeleter.namedFactory("dds-walk-"));
            try {
                boolean exhausted = false;
                while (true) {
                    if (!token.isCancelled() && live.size() < cfg.concurrencyLimit()
                            && (!exhausted || queueChanged)) {
                        queueChanged = false;
                        exhausted = dispatch(workers);
                    }

                    if (live.isEmpty()) {
                        if (!buffer.isEmpty()) {
                            flush();
                            continue;
                        }
                        if (token.isCancelled() || exhausted) break;
                        continue;
                    }

                    awaitResults();
                    expireOverdue();
                    maybeFlush(exhausted);
                }
            } finally {
                for (LiveTask t : live.values()) {
                    t.token().cancel();
                    t.future().cancel(true);
                }
                live.clear();
                stats.inFlight.set(0);
                workers.shutdownNow();
            }
        }

        /** Returns true when the queue had nothing pending for this session. */
        private boolean dispatch(ExecutorService workers) {
            Dequeued d = queue.dequeueBatch(sessionId, cfg.concurrencyLimit() - live.size());

            if (!d.resolvedFresh().isEmpty()) {
                stats.dirsSkipped.add(d.resolvedFresh().size());
                if (cfg.recursive()) {
                    List<Path> expand = new ArrayList<>();
                    for (Path p : d.resolvedFresh()) expand.addAll(cache.cachedChildren(p));
                    if (!expand.isEmpty()) queue.enqueue(sessionId, expand);
                }
            }

            for (Claim c : d.claimed()) submit(workers, c);
            stats.inFlight.set(live.size());
            return d.isEmpty();
        }

        private void submit(ExecutorService workers, Claim claim) {
            Path dir = claim.path();
            if (claim.status() == CacheStatus.INCOMPLETE || resumedPaths.contains(dir)) stats.dirsResumed.increment();
            else stats.dirsNew.increment();

            long id = ++taskSeq;
            CancellationToken taskToken = token.child();
            Future<?> future = workers.submit(() -> {
                WalkResult r;
                try {
                    r = scanner.scan(dir, taskToken);
                } catch (RuntimeException e) {
                    r = WalkResult.failed(dir, Anomaly.IO_ERROR, e.toString());
                }
                results.add(new TaskResult(id, r));
            });
            live.put(dir, new LiveTask(id, dir, taskToken, future, System.nanoTime() + timeoutNs));
        }

        private void awaitResults() {
            long now = System.nanoTime();
            long wait = MAX_POLL_NS;
            for (LiveTask t : live.values()) wait = Math.min(wait, t.deadlineNs() - now);
            if (!buffer.isEmpty()) wait = Math.min(wait, lastFlushNs + flushIntervalNs - now);
            wait = Math.max(MIN_POLL_NS, wait);

            TaskResult first;
            try {
                first = results.poll(wait, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                // treated as a cancellation request; the flag is restored once the session is closed
                interrupted = true;
                token.cancel();
                return;
            }
            if (first == null) return;

            List<TaskResult> batch = new ArrayList<>();
            batch.add(first);
            results.drainTo(batch);
            for (TaskResult r : batch) handle(r);
            stats.inFlight.set(live.size());
        }

        private void handle(TaskResult tr) {
            WalkResult r = tr.result();
            Path dir = r.dir();
            LiveTask t = live.get(dir);
            if (t == null || t.id() != tr.taskId()) {
                logger.debug("Dropping late result for {}", dir);
                return;
            }
            live.remove(dir);
            long now = clock.millis();
            String key = dir.toString();

            if (r.anomaly() == Anomaly.EXCLUDED) {
                buffer.complete(dir, QueueState.COMPLETED, r.error());
                stats.dirsSkipped.increment();
                return;
            }
            if (r.isError()) {
                logger.debug("Cannot scan {}: {}", dir, r.error());
                buffer.complete(dir, QueueState.FAILED, r.error());
                buffer.cache(new CacheUpdate(key, now, true, r.error(), false, sessionId));
                stats.dirsErrored.increment();
                return;
            }

            boolean matchFound = !r.matches().isEmpty();
            buffer.found(r.matches());
            if (cfg.recursive()) {
                buffer.discover(r.children());
                stats.dirsSkipped.add(r.skippedChildren());
            }

            if (r.interrupted()) {
                buffer.release(dir);
                buffer.cache(new CacheUpdate(key, now, false, null, matchFound, sessionId));
            } else {
                buffer.complete(dir, QueueState.COMPLETED, null);
                buffer.cache(new CacheUpdate(key, now, true, null, matchFound, sessionId));
            }
        }

        private void expireOverdue() {
            long nowNs = System.nanoTime();
            Iterator<LiveTask> it = live.values().iterator();
            while (it.hasNext()) {
                LiveTask t = it.next();
                if (t.deadlineNs() > nowNs) continue;

                t.token().cancel();
                t.future().cancel(true);
                it.remove();

                logger.debug("Timed out scanning {} after {}", t.dir(), cfg.taskTimeout());
                buffer.complete(t.dir(), QueueState.FAILED, TIMEOUT_NOTE);
                buffer.cache(new CacheUpdate(t.dir().toString(), clock.millis(), true, TIMEOUT_NOTE, false, sessionId));
                stats.dirsErrored.increment();
            }
            stats.inFlight.set(live.size());
        }

        private void maybeFlush(boolean exhausted) {
            if (buffer.isEmpty()) return;
            long sinceFlush = System.nanoTime() - lastFlushNs;
            boolean full = buffer.size() >= cfg.flushThreshold();
            boolean due = sinceFlush >= flushIntervalNs;
            boolean starved = exhausted
                    && buffer.discoveredCount() > 0
                    && live.size() < cfg.concurrencyLimit()
                    && sinceFlush >= STARVED_FLUSH_LATENCY_NS;
            if (full || due || starved) flush();
        }

        private void flush() {
            WriteBuffer.Batch b = buffer.drain();
            long now = clock.millis();
            SessionCounters counters = stats.toCounters();

            int inserted = jdbi.withExtension(SweepDao.class, dao -> dao.commitBatch(
                    sessionId, b.completions(), b.released(), b.discovered(), b.found(), counters, now));
            stats.filesFound.add(inserted);
            lastFlushNs = System.nanoTime();
            queueChanged = true;

            cache.recordResults(b.cacheUpdates());
            stats.queueDepth.set(queue.pendingCount(sessionId));

            logger.debug("Session {}: flushed {} outcomes, {} new directories, {} new matches",
                    sessionId, b.completions().size() + b.released().size(), b.discovered().size(), inserted);
        }
    }
}
