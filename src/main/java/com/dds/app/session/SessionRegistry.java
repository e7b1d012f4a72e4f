package com.dds.app.session;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.database.Database.SessionRow;
import com.dds.app.database.SweepDao;
import com.dds.app.database.SweepDao.SessionCounters;

/**
 * Durable record of search sessions and their lifecycle transitions.
 * Storage errors propagate: losing session state threatens resumability.
 */
public final class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    public record SessionStart(Session session, boolean resumed) {}

    private final Jdbi jdbi;
    private final Clock clock;

    public SessionRegistry(Jdbi jdbi, Clock clock) {
        this.jdbi = jdbi;
        this.clock = clock;
    }

    /**
     * Resumes the latest unfinished session for the same root, recursive, force and dry-run flags,
     * or creates a new one. An {@code ACTIVE} row found here belongs to a process that died without
     * marking it; it is recorded as interrupted first. A forced run only resumes a forced session.
     *
     * <p>The caller resets the resumed session's in-progress queue entries.
     */
    public SessionStart start(Path root, boolean recursive, boolean force, boolean dryRun) {
        String rootKey = root.toString();

        Optional<SessionRow> candidate = jdbi.withExtension(SweepDao.class,
                dao -> dao.findResumableSession(rootKey, recursive, dryRun, force));

        if (candidate.isPresent()) {
            SessionRow row = candidate.get();
            if (SessionStatus.ACTIVE.name().equals(row.status())) {
                logger.warn("Session {} was left active by a previous process; treating it as interrupted", row.id());
                transition(row.id(), SessionStatus.ACTIVE, SessionStatus.INTERRUPTED);
            }

            boolean hasWork = jdbi.withExtension(SweepDao.class, dao ->
                    dao.countOpenEntries(row.id()) > 0 || !dao.fetchUndecidedFoundFiles(row.id()).isEmpty());

            if (hasWork) {
                transition(row.id(), SessionStatus.INTERRUPTED, SessionStatus.ACTIVE);
                logger.info("Resuming session {} for {}", row.id(), rootKey);
                return new SessionStart(require(row.id()), true);
            }

            // nothing left to do: close it and start over
            transition(row.id(), SessionStatus.INTERRUPTED, SessionStatus.COMPLETED);
        }

        String id = UUID.randomUUID().toString();
        long now = clock.millis();
        jdbi.useExtension(SweepDao.class, dao -> dao.insertSession(id, rootKey, recursive, force, dryRun, now));
        logger.info("Started session {} for {}", id, rootKey);
        return new SessionStart(require(id), false);
    }

    public Optional<Session> find(String id) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.findSession(id)).map(Session::from);
    }

    public Session require(String id) {
        return find(id).orElseThrow(() -> new IllegalStateException("Unknown session: " + id));
    }

    /**
     * Applies one state-machine edge. The update is guarded by the expected current status.
     *
     * @throws IllegalStateException if the edge is not allowed or the row is not in {@code from}
     */
    public void transition(String id, SessionStatus from, SessionStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal session transition " + from + " -> " + to);
        }
        int updated = jdbi.withExtension(SweepDao.class,
                dao -> dao.transitionSession(id, from.name(), to.name(), clock.millis()));
        if (updated != 1) {
            throw new IllegalStateException("Session " + id + " is not " + from + "; cannot move to " + to);
        }
        logger.debug("Session {}: {} -> {}", id, from, to);
    }

    public void markCompleted(String id) {
        transition(id, SessionStatus.ACTIVE, SessionStatus.COMPLETED);
    }

    public void markInterrupted(String id) {
        transition(id, SessionStatus.ACTIVE, SessionStatus.INTERRUPTED);
    }

    public void markFailed(String id) {
        transition(id, SessionStatus.ACTIVE, SessionStatus.FAILED);
    }

    public void reactivate(String id) {
        transition(id, SessionStatus.INTERRUPTED, SessionStatus.ACTIVE);
    }

    public void recordCounters(String id, SessionCounters counters) {
        jdbi.useExtension(SweepDao.class, dao -> dao.updateSessionCounters(id, counters, clock.millis()));
    }

    /**
     * Declares every interrupted session done. Returns how many were closed.
     */
    public int closeAbandoned() {
        List<SessionRow> interrupted = jdbi.withExtension(SweepDao.class,
                dao -> dao.fetchSessionsByStatus(SessionStatus.INTERRUPTED.name()));
        int closed = 0;
        for (SessionRow row : interrupted) {
            transition(row.id(), SessionStatus.INTERRUPTED, SessionStatus.COMPLETED);
            closed++;
        }
        return closed;
    }

    /**
     * Deletes unfinished sessions (and their queue and ledger rows) created before {@code olderThan}.
     */
    public int cleanupStale(Instant olderThan) {
        List<String> stale = jdbi.withExtension(SweepDao.class,
                dao -> dao.fetchStaleSessionIds(olderThan.toEpochMilli()));
        for (String id : stale) {
            jdbi.useExtension(SweepDao.class, dao -> dao.deleteSession(id));
        }
        if (!stale.isEmpty()) logger.info("Removed {} stale sessions created before {}", stale.size(), olderThan);
        return stale.size();
    }

    public List<Session> listRecent(int limit) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.fetchRecentSessions(Math.max(1, limit)))
                .stream().map(Session::from).toList();
    }

    /** Active and interrupted sessions, newest first. */
    public List<Session> listIncomplete() {
        List<Session> out = new ArrayList<>(listByStatus(SessionStatus.ACTIVE));
        out.addAll(listByStatus(SessionStatus.INTERRUPTED));
        out.sort(Comparator.comparing(Session::createdAt).reversed());
        return out;
    }

    public List<Session> listByStatus(SessionStatus status) {
        return jdbi.withExtension(SweepDao.class, dao -> dao.fetchSessionsByStatus(status.name()))
                .stream().map(Session::from).toList();
    }
}
