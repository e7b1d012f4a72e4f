package com.dds.app.ledger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.dds.app.database.Database;
import com.dds.app.session.SessionRegistry;
import com.dds.app.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

public class FoundFilesLedgerTest {

    private Database db;
    private FoundFilesLedger ledger;
    private String sessionId;

    @BeforeEach
    void setUp() throws Exception {
        db = Database.open(Files.createTempDirectory("dds-ledger-").resolve("cache.sqlite"));
        MutableClock clock = MutableClock.startingNow();
        ledger = new FoundFilesLedger(db.jdbi(), clock);
        sessionId = new SessionRegistry(db.jdbi(), clock).start(Path.of("/r"), true, false, false).session().id();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void recordIgnoresDuplicates() {
        Path a = Path.of("/r/a/.DS_Store");
        Path b = Path.of("/r/b/.DS_Store");

        assertEquals(2, ledger.record(sessionId, List.of(a, b, a)));
        assertEquals(0, ledger.record(sessionId, List.of(a)));
        assertEquals(2, ledger.count(sessionId));
        assertEquals(0, ledger.record(sessionId, List.of()));
    }

    @Test
    void outcomeIsSetExactlyOnce() {
        Path a = Path.of("/r/a/.DS_Store");
        ledger.record(sessionId, List.of(a));

        assertTrue(ledger.setOutcome(sessionId, a, DeletionOutcome.DELETE_FAILED, "busy"));
        assertFalse(ledger.setOutcome(sessionId, a, DeletionOutcome.DELETED, null), "A decided record is final");

        FoundFile f = ledger.list(sessionId).get(0);
        assertEquals(DeletionOutcome.DELETE_FAILED, f.outcome());
        assertEquals("busy", f.error());
    }

    @Test
    void pendingDeletionListsOnlyUndecidedRecords() {
        Path a = Path.of("/r/a/.DS_Store");
        Path b = Path.of("/r/b/.DS_Store");
        Path c = Path.of("/r/c/.DS_Store");
        ledger.record(sessionId, List.of(a, b, c));
        ledger.setOutcome(sessionId, b, DeletionOutcome.DELETED, null);

        assertEquals(List.of(a, c), ledger.pendingDeletion(sessionId));
        assertNull(ledger.list(sessionId).get(0).outcome());

        Map<DeletionOutcome, Long> counts = ledger.countByOutcome(sessionId);
        assertEquals(1L, counts.get(DeletionOutcome.DELETED));
        assertEquals(0L, counts.get(DeletionOutcome.DRY_RUN_SKIPPED));
        assertEquals(0L, counts.get(DeletionOutcome.DELETE_FAILED));
    }
}
