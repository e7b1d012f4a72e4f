package com.dds.app.sweep;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

import com.dds.app.database.SweepDao.SessionCounters;
import com.dds.app.session.Session;

/**
 * Live counters of a sweep. Written by the orchestrator, read by reporters via {@link #snapshot()}.
 */
public final class SweepStats {

    public final LongAdder dirsNew = new LongAdder();
    public final LongAdder dirsResumed = new LongAdder();
    public final LongAdder dirsSkipped = new LongAdder();
    public final LongAdder dirsErrored = new LongAdder();
    public final LongAdder filesFound = new LongAdder();
    public final LongAdder filesDeleted = new LongAdder();
    public final LongAdder deleteErrors = new LongAdder();
    public final AtomicLong queueDepth = new AtomicLong();
    public final AtomicLong inFlight = new AtomicLong();

    public volatile long startedAtNanos = System.nanoTime();

    /** Continues the persisted counters of a resumed session. */
    public void seed(Session session) {
        dirsNew.add(session.dirsNew());
        dirsResumed.add(session.dirsResumed());
        dirsSkipped.add(session.dirsSkipped());
        dirsErrored.add(session.dirsErrored());
        filesFound.add(session.filesFound());
        filesDeleted.add(session.filesDeleted());
    }

    public SessionCounters toCounters() {
        return new SessionCounters(
                dirsNew.sum(),
                dirsResumed.sum(),
                dirsSkipped.sum(),
                dirsErrored.sum(),
                filesFound.sum(),
                filesDeleted.sum()
        );
    }

    public StatsSnapshot snapshot() {
        long elapsedMs = Math.max(0, (System.nanoTime() - startedAtNanos) / 1_000_000);
        return new StatsSnapshot(
                dirsNew.sum(),
                dirsResumed.sum(),
                dirsSkipped.sum(),
                dirsErrored.sum(),
                filesFound.sum(),
                filesDeleted.sum(),
                dirsErrored.sum() + deleteErrors.sum(),
                queueDepth.get(),
                inFlight.get(),
                elapsedMs
        );
    }

    public record StatsSnapshot(
            long dirsNew,
            long dirsResumed,
            long dirsSkipped,
            long dirsErrored,
            long filesFound,
            long filesDeleted,
            long errors,
            long queueDepth,
            long inFlight,
            long elapsedMillis
    ) {

        public long dirsScanned() {
            return dirsNew + dirsResumed;
        }

        public double dirsPerSecond() {
            if (elapsedMillis <= 0) return 0.0;
            return dirsScanned() * 1000.0 / elapsedMillis;
        }
    }
}
