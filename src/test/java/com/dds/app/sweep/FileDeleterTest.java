package com.dds.app.sweep;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.dds.app.database.Database;
import com.dds.app.ledger.DeletionOutcome;
import com.dds.app.ledger.FoundFile;
import com.dds.app.ledger.FoundFilesLedger;
import com.dds.app.session.SessionRegistry;
import com.dds.app.support.MutableClock;

import static org.junit.jupiter.api.Assertions.*;

public class FileDeleterTest {

    private Database db;
    private Path dir;
    private FoundFilesLedger ledger;
    private String sessionId;
    private SweepStats stats;

    @BeforeEach
    void setUp() throws Exception {
        db = Database.open(Files.createTempDirectory("dds-delete-db-").resolve("cache.sqlite"));
        dir = Files.createTempDirectory("dds-delete-");
        MutableClock clock = MutableClock.startingNow();
        ledger = new FoundFilesLedger(db.jdbi(), clock);
        sessionId = new SessionRegistry(db.jdbi(), clock).start(dir, true, false, false).session().id();
        stats = new SweepStats();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private List<Path> createMatches(int n) throws Exception {
        List<Path> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            Path sub = Files.createDirectories(dir.resolve("d" + i));
            out.add(Files.createFile(sub.resolve(".DS_Store")));
        }
        ledger.record(sessionId, out);
        return out;
    }

    @Test
    void deletesEveryUndecidedFile() throws Exception {
        List<Path> files = createMatches(20);

        FileDeleter.Summary s = new FileDeleter(ledger, 4).deleteAll(sessionId, false, CancellationToken.create(), stats);

        assertEquals(20, s.deleted());
        assertEquals(0, s.undecided());
        for (Path f : files) assertFalse(Files.exists(f));
        assertEquals(20, stats.filesDeleted.sum());
        assertEquals(20L, ledger.countByOutcome(sessionId).get(DeletionOutcome.DELETED));
        assertTrue(ledger.pendingDeletion(sessionId).isEmpty());
    }

    @Test
    void dryRunTouchesNothingOnDisk() throws Exception {
        List<Path> files = createMatches(3);

        FileDeleter.Summary s = new FileDeleter(ledger, 4).deleteAll(sessionId, true, CancellationToken.create(), stats);

        assertEquals(3, s.dryRunSkipped());
        assertEquals(0, s.deleted());
        for (Path f : files) assertTrue(Files.exists(f));
        assertEquals(0, stats.filesDeleted.sum());
        for (FoundFile f : ledger.list(sessionId)) assertEquals(DeletionOutcome.DRY_RUN_SKIPPED, f.outcome());
    }

    @Test
    void alreadyRemovedFileCountsAsDeleted_directoryCountsAsFailure() throws Exception {
        Path gone = dir.resolve("gone/.DS_Store");
        Path notAFile = Files.createDirectories(dir.resolve("odd/.DS_Store"));
        ledger.record(sessionId, List.of(gone, notAFile));

        FileDeleter.Summary s = new FileDeleter(ledger, 2).deleteAll(sessionId, false, CancellationToken.create(), stats);

        assertEquals(1, s.deleted());
        assertEquals(1, s.failed());
        assertEquals(1, stats.deleteErrors.sum());
        assertTrue(Files.isDirectory(notAFile));
        Map<DeletionOutcome, Long> counts = ledger.countByOutcome(sessionId);
        assertEquals(1L, counts.get(DeletionOutcome.DELETE_FAILED));
    }

    @Test
    void cancelledRunLeavesRecordsUndecided() throws Exception {
        List<Path> files = createMatches(5);
        CancellationToken token = CancellationToken.create();
        token.cancel();

        FileDeleter.Summary s = new FileDeleter(ledger, 4).deleteAll(sessionId, false, token, stats);

        assertEquals(5, s.undecided());
        for (Path f : files) assertTrue(Files.exists(f));
        assertEquals(5, ledger.pendingDeletion(sessionId).size());
    }
}
