package com.dds.app.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.dds.app.cache.DirectoryCache;
import com.dds.app.database.Database;
import com.dds.app.database.SweepDao.SessionCounters;
import com.dds.app.ledger.FoundFilesLedger;
import com.dds.app.queue.WorkQueue;
import com.dds.app.session.SessionRegistry.SessionStart;
import com.dds.app.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

public class SessionRegistryTest {

    private static final Path ROOT = Path.of("/volumes/share");

    private Database db;
    private MutableClock clock;
    private SessionRegistry sessions;
    private WorkQueue queue;

    @BeforeEach
    void setUp() throws Exception {
        db = Database.open(Files.createTempDirectory("dds-session-").resolve("cache.sqlite"));
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        sessions = new SessionRegistry(db.jdbi(), clock);
        queue = new WorkQueue(db.jdbi(), new DirectoryCache(db.jdbi(), Duration.ofHours(24), false, clock), clock);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void stateMachineAllowsOnlyDocumentedEdges() {
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.COMPLETED));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.INTERRUPTED));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.FAILED));
        assertTrue(SessionStatus.INTERRUPTED.canTransitionTo(SessionStatus.ACTIVE));
        assertTrue(SessionStatus.INTERRUPTED.canTransitionTo(SessionStatus.COMPLETED));

        assertFalse(SessionStatus.INTERRUPTED.canTransitionTo(SessionStatus.FAILED));
        assertFalse(SessionStatus.COMPLETED.canTransitionTo(SessionStatus.ACTIVE));
        assertFalse(SessionStatus.FAILED.canTransitionTo(SessionStatus.ACTIVE));
        assertTrue(SessionStatus.COMPLETED.isTerminal());
        assertTrue(SessionStatus.FAILED.isTerminal());
        assertFalse(SessionStatus.INTERRUPTED.isTerminal());
    }

    @Test
    void newSessionStartsActive_andCompletesOnce() {
        SessionStart start = sessions.start(ROOT, true, false, false);
        Session s = start.session();

        assertFalse(start.resumed());
        assertEquals(SessionStatus.ACTIVE, s.status());
        assertEquals(ROOT, s.root());
        assertNull(s.completedAt());

        clock.advance(Duration.ofMinutes(3));
        sessions.markCompleted(s.id());
        Session done = sessions.require(s.id());
        assertEquals(SessionStatus.COMPLETED, done.status());
        assertEquals(clock.instant(), done.completedAt());

        assertThrows(IllegalStateException.class, () -> sessions.markInterrupted(s.id()),
                "Completed is terminal");
        assertThrows(IllegalStateException.class, () -> sessions.reactivate(s.id()));
    }

    @Test
    void interruptedSessionWithQueueWorkIsResumed() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        queue.enqueue(id, List.of(ROOT.resolve("a"), ROOT.resolve("b")));
        sessions.recordCounters(id, new SessionCounters(4, 0, 1, 0, 2, 0));
        sessions.markInterrupted(id);

        SessionStart again = sessions.start(ROOT, true, false, false);

        assertTrue(again.resumed());
        assertEquals(id, again.session().id());
        assertEquals(SessionStatus.ACTIVE, again.session().status());
        assertEquals(4, again.session().dirsNew());
        assertEquals(2, again.session().filesFound());
    }

    @Test
    void resumeRequiresSameRootAndFlags() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        queue.enqueue(id, List.of(ROOT.resolve("a")));
        sessions.markInterrupted(id);

        assertFalse(sessions.start(ROOT, false, false, false).resumed(), "Different recursion");
        assertFalse(sessions.start(ROOT, true, false, true).resumed(), "Different dry-run flag");
        assertFalse(sessions.start(ROOT.resolve("sub"), true, false, false).resumed(), "Different root");
        assertFalse(sessions.start(ROOT, true, true, false).resumed(), "A forced run does not adopt a normal session");

        assertEquals(SessionStatus.INTERRUPTED, sessions.require(id).status());
    }

    @Test
    void forcedSessionIsResumedOnlyByAForcedRun() {
        String id = sessions.start(ROOT, true, true, false).session().id();
        queue.enqueue(id, List.of(ROOT.resolve("a")));
        sessions.markInterrupted(id);

        SessionStart normal = sessions.start(ROOT, true, false, false);
        assertFalse(normal.resumed(), "A normal run does not adopt a forced session");
        assertEquals(SessionStatus.INTERRUPTED, sessions.require(id).status());

        SessionStart forced = sessions.start(ROOT, true, true, false);
        assertTrue(forced.resumed());
        assertEquals(id, forced.session().id());
        assertTrue(forced.session().force());
    }

    @Test
    void orphanedActiveSessionIsInterruptedThenResumed() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        queue.enqueue(id, List.of(ROOT.resolve("pending")));
        // process "dies" here: the row stays ACTIVE

        SessionStart again = sessions.start(ROOT, true, false, false);

        assertTrue(again.resumed());
        assertEquals(id, again.session().id());
        assertEquals(SessionStatus.ACTIVE, again.session().status());
    }

    @Test
    void interruptedSessionWithoutWorkIsClosedAndReplaced() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        sessions.markInterrupted(id);

        SessionStart again = sessions.start(ROOT, true, false, false);

        assertFalse(again.resumed());
        assertNotEquals(id, again.session().id());
        assertEquals(SessionStatus.COMPLETED, sessions.require(id).status());
    }

    @Test
    void undecidedFoundFilesAloneMakeASessionResumable() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        new FoundFilesLedger(db.jdbi(), clock).record(id, List.of(ROOT.resolve(".DS_Store")));
        sessions.markInterrupted(id);

        assertTrue(sessions.start(ROOT, true, false, false).resumed());
    }

    @Test
    void failedSessionIsNeverResumed() {
        String id = sessions.start(ROOT, true, false, false).session().id();
        queue.enqueue(id, List.of(ROOT.resolve("a")));
        sessions.markFailed(id);

        SessionStart again = sessions.start(ROOT, true, false, false);
        assertFalse(again.resumed());
        assertEquals(SessionStatus.FAILED, sessions.require(id).status());
    }

    @Test
    void closeAbandonedCompletesInterruptedSessions() {
        String a = sessions.start(ROOT, true, false, false).session().id();
        sessions.markInterrupted(a);
        String b = sessions.start(ROOT.resolve("other"), true, false, false).session().id();
        sessions.markInterrupted(b);
        String c = sessions.start(ROOT.resolve("third"), true, false, false).session().id();

        assertEquals(3, sessions.listIncomplete().size());
        assertEquals(2, sessions.closeAbandoned());
        assertEquals(SessionStatus.COMPLETED, sessions.require(a).status());
        assertEquals(SessionStatus.COMPLETED, sessions.require(b).status());
        assertEquals(SessionStatus.ACTIVE, sessions.require(c).status());
    }

    @Test
    void cleanupStaleDeletesOldUnfinishedSessionsWithTheirRows() {
        String old = sessions.start(ROOT, true, false, false).session().id();
        queue.enqueue(old, List.of(ROOT.resolve("x")));
        new FoundFilesLedger(db.jdbi(), clock).record(old, List.of(ROOT.resolve(".DS_Store")));
        sessions.markInterrupted(old);

        String oldDone = sessions.start(ROOT.resolve("done"), true, false, false).session().id();
        sessions.markCompleted(oldDone);

        clock.advance(Duration.ofDays(3));
        String recent = sessions.start(ROOT.resolve("recent"), true, false, false).session().id();

        int removed = sessions.cleanupStale(clock.instant().minus(Duration.ofHours(48)));

        assertEquals(1, removed);
        assertTrue(sessions.find(old).isEmpty());
        assertTrue(sessions.find(oldDone).isPresent(), "Completed sessions are history, not stale work");
        assertTrue(sessions.find(recent).isPresent());
        assertEquals(0, queue.openCount(old));
        assertEquals(0, new FoundFilesLedger(db.jdbi(), clock).count(old));
    }

    @Test
    void listRecentIsNewestFirst() {
        String first = sessions.start(ROOT.resolve("1"), true, false, false).session().id();
        clock.advance(Duration.ofSeconds(1));
        String second = sessions.start(ROOT.resolve("2"), true, false, false).session().id();

        List<Session> recent = sessions.listRecent(10);
        assertEquals(second, recent.get(0).id());
        assertEquals(first, recent.get(1).id());
        assertEquals(1, sessions.listRecent(1).size());
    }
}
