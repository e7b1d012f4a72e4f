package com.dds.app.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.dds.app.cache.CacheStatus;
import com.dds.app.cache.DirectoryCache;
import com.dds.app.database.Database;
import com.dds.app.session.SessionRegistry;
import com.dds.app.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

public class WorkQueueTest {

    private Database db;
    private MutableClock clock;
    private DirectoryCache cache;
    private WorkQueue queue;
    private String sessionId;

    @BeforeEach
    void setUp() throws Exception {
        db = Database.open(Files.createTempDirectory("dds-queue-").resolve("cache.sqlite"));
        clock = MutableClock.startingNow();
        cache = new DirectoryCache(db.jdbi(), Duration.ofHours(24), false, clock);
        queue = new WorkQueue(db.jdbi(), cache, clock);
        sessionId = new SessionRegistry(db.jdbi(), clock)
                .start(Path.of("/root"), true, false, false).session().id();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static List<Path> paths(String... names) {
        List<Path> out = new ArrayList<>();
        for (String n : names) out.add(Path.of("/root", n));
        return out;
    }

    @Test
    void enqueueIsIdempotentPerSession() {
        assertEquals(3, queue.enqueue(sessionId, paths("a", "b", "c")));
        assertEquals(1, queue.enqueue(sessionId, paths("a", "b", "d")), "Known paths are ignored");
        assertEquals(4, queue.pendingCount(sessionId));
    }

    @Test
    void claimedPathIsNeverHandedOutAgain() {
        queue.enqueue(sessionId, paths("a"));

        WorkQueue.Dequeued first = queue.dequeueBatch(sessionId, 10);
        assertEquals(1, first.claimed().size());
        assertEquals(CacheStatus.NOT_CACHED, first.claimed().get(0).status());

        queue.enqueue(sessionId, paths("a"));
        assertTrue(queue.dequeueBatch(sessionId, 10).isEmpty(), "Re-enqueueing a claimed path does nothing");

        assertTrue(queue.complete(sessionId, Path.of("/root/a"), QueueState.COMPLETED, null));
        assertFalse(queue.complete(sessionId, Path.of("/root/a"), QueueState.FAILED, "late"),
                "Completion only applies to in-progress entries");
        assertEquals(QueueState.COMPLETED, queue.stateOf(sessionId, Path.of("/root/a")));
    }

    @Test
    void concurrentDequeuesClaimEachPathAtMostOnce() throws Exception {
        List<Path> all = new ArrayList<>();
        for (int i = 0; i < 200; i++) all.add(Path.of("/root", "d" + i));
        queue.enqueue(sessionId, all);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Path> claimed = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    while (true) {
                        WorkQueue.Dequeued d = queue.dequeueBatch(sessionId, 7);
                        if (d.isEmpty()) return null;
                        d.claimed().forEach(c -> claimed.add(c.path()));
                    }
                }));
            }
            go.countDown();
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        Set<Path> unique = new HashSet<>(claimed);
        assertEquals(claimed.size(), unique.size(), "No path was claimed twice");
        assertEquals(new HashSet<>(all), unique);
        assertEquals(200, queue.countInState(sessionId, QueueState.IN_PROGRESS));
    }

    @Test
    void freshEntriesAreCompletedWithoutBeingClaimed() {
        Path fresh = Path.of("/root/fresh");
        Path stale = Path.of("/root/stale");
        Path partial = Path.of("/root/partial");
        cache.recordResult("old", stale, true, null, false);
        clock.advance(Duration.ofHours(25));
        cache.recordResult("old", fresh, true, null, false);
        cache.recordResult("old", partial, false, null, false);

        queue.enqueue(sessionId, List.of(fresh, stale, partial));
        WorkQueue.Dequeued d = queue.dequeueBatch(sessionId, 10);

        assertEquals(List.of(fresh), d.resolvedFresh());
        assertEquals(2, d.claimed().size());
        assertTrue(d.claimed().contains(new WorkQueue.Claim(stale, CacheStatus.STALE)));
        assertTrue(d.claimed().contains(new WorkQueue.Claim(partial, CacheStatus.INCOMPLETE)));

        QueueEntry entry = queue.find(sessionId, fresh).orElseThrow();
        assertEquals(QueueState.COMPLETED, entry.state());
        assertEquals(WorkQueue.CACHE_FRESH_NOTE, entry.note());
    }

    @Test
    void resumeResetsInProgressEntriesAndKeepsPending() {
        queue.enqueue(sessionId, paths("p1", "p2", "p3", "w1", "w2", "done"));
        // claim three, finish one of them: two stay in progress
        WorkQueue.Dequeued d = queue.dequeueBatch(sessionId, 3);
        assertEquals(3, d.claimed().size());
        Path finished = d.claimed().get(2).path();
        queue.complete(sessionId, finished, QueueState.COMPLETED, null);

        ResumePlan plan = queue.resume(sessionId);

        assertEquals(3, plan.alreadyPending().size());
        assertEquals(2, plan.toReset().size());
        assertEquals(5, plan.resumableCount());
        assertEquals(5, queue.pendingCount(sessionId));
        assertEquals(0, queue.countInState(sessionId, QueueState.IN_PROGRESS));
        assertEquals(QueueState.COMPLETED, queue.stateOf(sessionId, finished));
        assertEquals(5, queue.incompleteEntries(sessionId).size());
    }

    @Test
    void releasePutsClaimBackAndRejectsNonTerminalCompletion() {
        queue.enqueue(sessionId, paths("x"));
        Path x = queue.dequeueBatch(sessionId, 1).claimed().get(0).path();

        assertThrows(IllegalArgumentException.class, () -> queue.complete(sessionId, x, QueueState.PENDING, null));
        assertTrue(queue.release(sessionId, x));
        assertFalse(queue.release(sessionId, x), "Only in-progress entries can be released");
        assertEquals(QueueState.PENDING, queue.stateOf(sessionId, x));
        assertEquals(1, queue.openCount(sessionId));
        assertNull(queue.stateOf(sessionId, Path.of("/root/nowhere")));
        assertTrue(queue.find(sessionId, Path.of("/root/nowhere")).isEmpty());
    }
}
