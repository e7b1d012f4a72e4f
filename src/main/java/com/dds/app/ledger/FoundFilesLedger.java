package com.dds.app.ledger;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.jdbi.v3.core.Jdbi;

import com.dds.app.database.SweepDao;

/**
 * Durable record of matched files per session. A record's outcome is written once.
 */
public final class FoundFilesLedger {

    private final Jdbi jdbi;
    private final Clock clock;

    public FoundFilesLedger(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    public int record(String sessionId, Collection<Path> files) {
        if (files.isEmpty()) return 0;
        List<String> keys = files.stream().map(Path::toString).distinct().toList();
        int[] counts = jdbi.withExtension(SweepDao.class, dao -> dao.insertFoundFiles(sessionId, keys, clock.millis()));
        int inserted = 0;
        for (int c : counts) inserted += c;
        return inserted;
    }

    public List<Path> pendingDeletion(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.fetchUndecidedFoundFiles(sessionId))
                .stream().map(Path::of).toList();
    }

    /**
     * Sets the outcome if none was set yet. Returns false when the record was already decided.
     */
    public boolean setOutcome(String sessionId, Path file, DeletionOutcome outcome, String error) {
        int updated = jdbi.withExtension(SweepDao.class,
                dao -> dao.setFoundFileOutcome(sessionId, file.toString(), outcome.name(), error));
        return updated == 1;
    }

    public List<FoundFile> list(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.fetchFoundFiles(sessionId))
                .stream().map(FoundFile::from).toList();
    }

    public long count(String sessionId) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.countFoundFiles(sessionId));
    }

    public Map<DeletionOutcome, Long> countByOutcome(String sessionId) {
        Map<DeletionOutcome, Long> out = new EnumMap<>(DeletionOutcome.class);
        jdbi.useExtension(SweepDao.class, dao -> {
            for (DeletionOutcome o : DeletionOutcome.values()) {
                out.put(o, dao.countFoundFilesWithOutcome(sessionId, o.name()));
            }
        });
        return out;
    }
}
