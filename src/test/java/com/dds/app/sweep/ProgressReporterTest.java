package com.dds.app.sweep;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.dds.app.sweep.SweepStats.StatsSnapshot;

import static org.junit.jupiter.api.Assertions.*;

public class ProgressReporterTest {

    @Test
    void reportsSnapshotsPeriodically() throws Exception {
        SweepStats stats = new SweepStats();
        stats.dirsNew.add(5);
        stats.filesFound.add(2);
        CountDownLatch ticks = new CountDownLatch(2);
        AtomicReference<StatsSnapshot> last = new AtomicReference<>();

        try (ProgressReporter reporter = new ProgressReporter(stats, Duration.ofMillis(10), s -> {
            last.set(s);
            ticks.countDown();
        })) {
            reporter.start();
            assertTrue(ticks.await(5, TimeUnit.SECONDS));
        }

        assertEquals(5, last.get().dirsNew());
        assertEquals(2, last.get().filesFound());
    }

    @Test
    void failingSinkDoesNotStopTheSchedule() throws Exception {
        CountDownLatch calls = new CountDownLatch(3);
        try (ProgressReporter reporter = new ProgressReporter(new SweepStats(), Duration.ofMillis(10), s -> {
            calls.countDown();
            throw new IllegalStateException("sink down");
        })) {
            reporter.start();
            assertTrue(calls.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void formatIncludesCountersAndRate() {
        StatsSnapshot s = new StatsSnapshot(8, 2, 3, 1, 4, 4, 1, 0, 0, 2000);

        assertEquals(10, s.dirsScanned());
        assertEquals(5.0, s.dirsPerSecond(), 0.0001);
        String line = ProgressReporter.format(s);
        assertTrue(line.contains("10 scanned"));
        assertTrue(line.contains("4 found"));
        assertTrue(line.contains("3 skipped"));
    }
}
