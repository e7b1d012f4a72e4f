package com.dds.app.sweep;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.sweep.SweepStats.StatsSnapshot;

/**
 * Periodically reads a {@link StatsSnapshot} and hands it to a sink. Reading the counters
 * never blocks the sweep.
 */
public final class ProgressReporter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    private final SweepStats stats;
    private final Duration period;
    private final Consumer<StatsSnapshot> sink;
    private final ScheduledExecutorService timer;

    public ProgressReporter(SweepStats stats, Duration period) {
        this(stats, period, ProgressReporter::log);
    }

    public ProgressReporter(SweepStats stats, Duration period, Consumer<StatsSnapshot> sink) {
        this.stats = stats;
        this.period = period;
        this.sink = sink;
        this.timer = Executors.newSingleThreadScheduledExecutor(FileDeleter.namedFactory("dds-progress-"));
    }

    public ProgressReporter start() {
        long ms = Math.max(1, period.toMillis());
        timer.scheduleAtFixedRate(this::report, ms, ms, TimeUnit.MILLISECONDS);
        return this;
    }

    private void report() {
        try {
            sink.accept(stats.snapshot());
        } catch (RuntimeException e) {
            // a failing sink must not cancel the schedule
            logger.debug("Progress sink failed: {}", e.toString());
        }
    }

    public static String format(StatsSnapshot s) {
        return String.format("dirs: %d scanned (%d new, %d resumed), %d skipped, %d errors | files: %d found, %d deleted | queue: %d, in flight: %d | %.1f dirs/s",
                s.dirsScanned(), s.dirsNew(), s.dirsResumed(), s.dirsSkipped(), s.errors(),
                s.filesFound(), s.filesDeleted(), s.queueDepth(), s.inFlight(), s.dirsPerSecond());
    }

    private static void log(StatsSnapshot s) {
        logger.info(format(s));
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
