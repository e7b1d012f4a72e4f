package com.dds.app.sweep;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.ledger.DeletionOutcome;
import com.dds.app.ledger.FoundFilesLedger;

/**
 * Decides the session's undecided ledger records with a bounded pool of delete workers.
 * Workers only touch the filesystem; outcomes are written to the ledger by the calling thread.
 */
public final class FileDeleter {

    private static final Logger logger = LoggerFactory.getLogger(FileDeleter.class);

    public record Summary(int deleted, int dryRunSkipped, int failed, int undecided) {}

    private record Decision(Path file, DeletionOutcome outcome, String error) {}

    private final FoundFilesLedger ledger;
    private final int parallelism;

    public FileDeleter(FoundFilesLedger ledger, int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
        this.ledger = ledger;
        this.parallelism = parallelism;
    }

    /**
     * In dry-run mode nothing is deleted and every record becomes {@code DRY_RUN_SKIPPED}.
     * Records still undecided when the token is cancelled stay undecided for a later resume.
     */
    public Summary deleteAll(String sessionId, boolean dryRun, CancellationToken token, SweepStats stats) {
        List<Path> pending = ledger.pendingDeletion(sessionId);
        if (pending.isEmpty()) return new Summary(0, 0, 0, 0);

        if (dryRun) {
            int skipped = 0;
            for (Path file : pending) {
                if (token.isCancelled()) break;
                logger.info("[dry-run] would delete {}", file);
                if (ledger.setOutcome(sessionId, file, DeletionOutcome.DRY_RUN_SKIPPED, null)) skipped++;
            }
            return new Summary(0, skipped, 0, pending.size() - skipped);
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, pending.size()),
                namedFactory("dds-delete-"));
        int deleted = 0;
        int failed = 0;
        try {
            List<Future<Decision>> futures = new ArrayList<>(pending.size());
            for (Path file : pending) {
                futures.add(pool.submit(() -> token.isCancelled() ? null : delete(file)));
            }
            for (Future<Decision> f : futures) {
                Decision d = await(f);
                if (d == null) continue;
                if (!ledger.setOutcome(sessionId, d.file(), d.outcome(), d.error())) continue;
                if (d.outcome() == DeletionOutcome.DELETED) {
                    deleted++;
                    stats.filesDeleted.increment();
                } else {
                    failed++;
                    stats.deleteErrors.increment();
                }
            }
        } finally {
            pool.shutdownNow();
        }

        if (failed > 0) logger.warn("Session {}: {} files could not be deleted", sessionId, failed);
        return new Summary(deleted, 0, failed, pending.size() - deleted - failed);
    }

    private static Decision delete(Path file) {
        try {
            if (Files.isSymbolicLink(file) || !Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                if (Files.notExists(file, LinkOption.NOFOLLOW_LINKS)) {
                    return new Decision(file, DeletionOutcome.DELETED, null);
                }
                return new Decision(file, DeletionOutcome.DELETE_FAILED, "not a regular file");
            }
            Files.delete(file);
            logger.debug("Deleted {}", file);
            return new Decision(file, DeletionOutcome.DELETED, null);
        } catch (NoSuchFileException e) {
            // already gone: the goal state holds
            return new Decision(file, DeletionOutcome.DELETED, null);
        } catch (IOException | SecurityException e) {
            logger.debug("Failed to delete {}: {}", file, e.toString());
            return new Decision(file, DeletionOutcome.DELETE_FAILED, e.toString());
        }
    }

    private static Decision await(Future<Decision> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Delete worker failed", e.getCause());
        }
    }

    static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
