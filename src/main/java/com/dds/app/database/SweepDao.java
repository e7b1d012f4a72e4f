package com.dds.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import com.dds.app.database.Database.CacheRow;
import com.dds.app.database.Database.CacheStatsRow;
import com.dds.app.database.Database.FoundFileRow;
import com.dds.app.database.Database.QueueRow;
import com.dds.app.database.Database.SessionRow;

public interface SweepDao {

    // --- Directory cache -----------------------------------------------------

    @SqlQuery("""
        SELECT path AS path,
               last_searched AS lastSearched,
               completed AS completed,
               error AS error,
               match_found AS matchFound,
               session_id AS sessionId
          FROM directory_cache
         WHERE path = :path
        """)
    @RegisterConstructorMapper(CacheRow.class)
    Optional<CacheRow> findCacheEntry(@Bind("path") String path);

    @SqlQuery("""
        SELECT path AS path,
               last_searched AS lastSearched
          FROM directory_cache
         WHERE last_searched > :cutoff
           AND completed = 1
        """)
    @RegisterConstructorMapper(FreshEntry.class)
    List<FreshEntry> fetchFreshComplete(@Bind("cutoff") long cutoff);

    record FreshEntry(String path, long lastSearched) {}

    // Range scan over the primary key: every path that starts with :lo
    @SqlQuery("""
        SELECT path
          FROM directory_cache
         WHERE path >= :lo
           AND path < :hi
         ORDER BY path
        """)
    List<String> fetchCachedDescendants(@Bind("lo") String lo, @Bind("hi") String hi);

    @SqlBatch("""
        INSERT INTO directory_cache (path, last_searched, completed, error, match_found, session_id)
        VALUES (:path, :lastSearched, :completed, :error, :matchFound, :sessionId)
        ON CONFLICT(path) DO UPDATE SET
            last_searched = excluded.last_searched,
            completed = excluded.completed,
            error = excluded.error,
            match_found = excluded.match_found,
            session_id = excluded.session_id
         WHERE excluded.last_searched >= directory_cache.last_searched
        """)
    int[] upsertCacheEntries(@BindMethods List<CacheUpdate> updates);

    record CacheUpdate(String path, long lastSearched, boolean completed, String error,
                       boolean matchFound, String sessionId) {}

    @SqlUpdate("""
        DELETE FROM directory_cache
         WHERE rowid IN (
            SELECT rowid
              FROM directory_cache
             WHERE last_searched < :cutoff
             LIMIT :limit
         )
        """)
    int pruneCacheChunk(@Bind("cutoff") long cutoff, @Bind("limit") int limit);

    @SqlQuery("""
        SELECT COUNT(*) AS total,
               COALESCE(SUM(CASE WHEN completed = 1 THEN 1 ELSE 0 END), 0) AS completed,
               COALESCE(SUM(CASE WHEN match_found = 1 THEN 1 ELSE 0 END), 0) AS withMatches,
               COALESCE(SUM(CASE WHEN error IS NOT NULL THEN 1 ELSE 0 END), 0) AS errors
          FROM directory_cache
        """)
    @RegisterConstructorMapper(CacheStatsRow.class)
    CacheStatsRow fetchCacheStats();

    @SqlQuery("SELECT path FROM directory_cache WHERE completed = 0 ORDER BY last_searched DESC")
    List<String> fetchIncompleteCachePaths();

    @SqlUpdate("DELETE FROM directory_cache WHERE completed = 0")
    int deleteIncompleteCacheEntries();

    // --- Sessions ------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO search_sessions (id, root, recursive_scan, force_refresh, dry_run, status, created_at, updated_at)
        VALUES (:id, :root, :recursive, :force, :dryRun, 'ACTIVE', :now, :now)
        """)
    void insertSession(@Bind("id") String id,
                       @Bind("root") String root,
                       @Bind("recursive") boolean recursive,
                       @Bind("force") boolean force,
                       @Bind("dryRun") boolean dryRun,
                       @Bind("now") long now);

    String SESSION_COLUMNS = """
        SELECT id AS id,
               root AS root,
               recursive_scan AS recursive,
               force_refresh AS force,
               dry_run AS dryRun,
               status AS status,
               created_at AS createdAt,
               updated_at AS updatedAt,
               completed_at AS completedAt,
               dirs_new AS dirsNew,
               dirs_resumed AS dirsResumed,
               dirs_skipped AS dirsSkipped,
               dirs_errored AS dirsErrored,
               files_found AS filesFound,
               files_deleted AS filesDeleted
          FROM search_sessions
        """;

    @SqlQuery(SESSION_COLUMNS + " WHERE id = :id")
    @RegisterConstructorMapper(SessionRow.class)
    Optional<SessionRow> findSession(@Bind("id") String id);

    @SqlQuery(SESSION_COLUMNS + """
         WHERE root = :root
           AND recursive_scan = :recursive
           AND dry_run = :dryRun
           AND force_refresh = :force
           AND status IN ('ACTIVE', 'INTERRUPTED')
         ORDER BY created_at DESC
         LIMIT 1
        """)
    @RegisterConstructorMapper(SessionRow.class)
    Optional<SessionRow> findResumableSession(@Bind("root") String root,
                                              @Bind("recursive") boolean recursive,
                                              @Bind("dryRun") boolean dryRun,
                                              @Bind("force") boolean force);

    @SqlQuery(SESSION_COLUMNS + " ORDER BY created_at DESC LIMIT :limit")
    @RegisterConstructorMapper(SessionRow.class)
    List<SessionRow> fetchRecentSessions(@Bind("limit") int limit);

    @SqlQuery(SESSION_COLUMNS + " WHERE status = :status ORDER BY created_at DESC")
    @RegisterConstructorMapper(SessionRow.class)
    List<SessionRow> fetchSessionsByStatus(@Bind("status") String status);

    @SqlUpdate("""
        UPDATE search_sessions
           SET status = :to,
               updated_at = :now,
               completed_at = CASE WHEN :to = 'COMPLETED' THEN :now ELSE completed_at END
         WHERE id = :id
           AND status = :from
        """)
    int transitionSession(@Bind("id") String id,
                          @Bind("from") String from,
                          @Bind("to") String to,
                          @Bind("now") long now);

    @SqlUpdate("""
        UPDATE search_sessions
           SET dirs_new = :dirsNew,
               dirs_resumed = :dirsResumed,
               dirs_skipped = :dirsSkipped,
               dirs_errored = :dirsErrored,
               files_found = :filesFound,
               files_deleted = :filesDeleted,
               updated_at = :now
         WHERE id = :id
        """)
    int updateSessionCounters(@Bind("id") String id,
                              @BindMethods SessionCounters counters,
                              @Bind("now") long now);

    record SessionCounters(long dirsNew, long dirsResumed, long dirsSkipped, long dirsErrored,
                           long filesFound, long filesDeleted) {

        public SessionCounters withFilesFound(long value) {
            return new SessionCounters(dirsNew, dirsResumed, dirsSkipped, dirsErrored, value, filesDeleted);
        }
    }

    @SqlQuery("SELECT id FROM search_sessions WHERE created_at < :cutoff AND status != 'COMPLETED'")
    List<String> fetchStaleSessionIds(@Bind("cutoff") long cutoff);

    @SqlUpdate("DELETE FROM work_queue WHERE session_id = :id")
    int deleteQueueForSession(@Bind("id") String id);

    @SqlUpdate("DELETE FROM found_files WHERE session_id = :id")
    int deleteFoundFilesForSession(@Bind("id") String id);

    @SqlUpdate("DELETE FROM search_sessions WHERE id = :id")
    int deleteSessionRow(@Bind("id") String id);

    @Transaction
    default int deleteSession(String id) {
        deleteQueueForSession(id);
        deleteFoundFilesForSession(id);
        return deleteSessionRow(id);
    }

    // --- Work queue ----------------------------------------------------------

    @SqlBatch("""
        INSERT INTO work_queue (session_id, path, state, enqueued_at)
        VALUES (:sessionId, :path, 'PENDING', :now)
        ON CONFLICT(session_id, path) DO NOTHING
        """)
    int[] enqueue(@Bind("sessionId") String sessionId,
                  @Bind("path") List<String> paths,
                  @Bind("now") long now);

    @SqlQuery("""
        SELECT path
          FROM work_queue
         WHERE session_id = :sessionId
           AND state = 'PENDING'
         ORDER BY enqueued_at, path
         LIMIT :limit
        """)
    List<String> peekPending(@Bind("sessionId") String sessionId, @Bind("limit") int limit);

    @SqlBatch("""
        UPDATE work_queue
           SET state = :to,
               error = :note
         WHERE session_id = :sessionId
           AND path = :path
           AND state = :from
        """)
    int[] transitionEntries(@Bind("sessionId") String sessionId,
                            @Bind("path") List<String> paths,
                            @Bind("from") String from,
                            @Bind("to") String to,
                            @Bind("note") String note);

    @SqlBatch("""
        UPDATE work_queue
           SET state = :state,
               error = :error
         WHERE session_id = :sessionId
           AND path = :path
           AND state = 'IN_PROGRESS'
        """)
    int[] completeEntries(@Bind("sessionId") String sessionId, @BindMethods List<QueueCompletion> completions);

    record QueueCompletion(String path, String state, String error) {}

    @SqlQuery("SELECT COUNT(*) FROM work_queue WHERE session_id = :sessionId AND state = :state")
    long countQueueState(@Bind("sessionId") String sessionId, @Bind("state") String state);

    @SqlQuery("""
        SELECT COUNT(*)
          FROM work_queue
         WHERE session_id = :sessionId
           AND state IN ('PENDING', 'IN_PROGRESS')
        """)
    long countOpenEntries(@Bind("sessionId") String sessionId);

    @SqlQuery("""
        SELECT session_id AS sessionId,
               path AS path,
               state AS state,
               enqueued_at AS enqueuedAt,
               error AS error
          FROM work_queue
         WHERE session_id = :sessionId
           AND state IN ('PENDING', 'IN_PROGRESS')
         ORDER BY enqueued_at, path
        """)
    @RegisterConstructorMapper(QueueRow.class)
    List<QueueRow> fetchOpenEntries(@Bind("sessionId") String sessionId);

    @SqlQuery("""
        SELECT session_id AS sessionId,
               path AS path,
               state AS state,
               enqueued_at AS enqueuedAt,
               error AS error
          FROM work_queue
         WHERE session_id = :sessionId
           AND path = :path
        """)
    @RegisterConstructorMapper(QueueRow.class)
    Optional<QueueRow> findQueueEntry(@Bind("sessionId") String sessionId, @Bind("path") String path);

    // --- Found files ---------------------------------------------------------

    @SqlBatch("""
        INSERT INTO found_files (session_id, path, found_at)
        VALUES (:sessionId, :path, :now)
        ON CONFLICT(session_id, path) DO NOTHING
        """)
    int[] insertFoundFiles(@Bind("sessionId") String sessionId,
                           @Bind("path") List<String> paths,
                           @Bind("now") long now);

    @SqlQuery("""
        SELECT path
          FROM found_files
         WHERE session_id = :sessionId
           AND outcome IS NULL
         ORDER BY found_at, path
        """)
    List<String> fetchUndecidedFoundFiles(@Bind("sessionId") String sessionId);

    @SqlUpdate("""
        UPDATE found_files
           SET outcome = :outcome,
               error = :error
         WHERE session_id = :sessionId
           AND path = :path
           AND outcome IS NULL
        """)
    int setFoundFileOutcome(@Bind("sessionId") String sessionId,
                            @Bind("path") String path,
                            @Bind("outcome") String outcome,
                            @Bind("error") String error);

    @SqlQuery("""
        SELECT session_id AS sessionId,
               path AS path,
               found_at AS foundAt,
               outcome AS outcome,
               error AS error
          FROM found_files
         WHERE session_id = :sessionId
         ORDER BY found_at, path
        """)
    @RegisterConstructorMapper(FoundFileRow.class)
    List<FoundFileRow> fetchFoundFiles(@Bind("sessionId") String sessionId);

    @SqlQuery("SELECT COUNT(*) FROM found_files WHERE session_id = :sessionId")
    long countFoundFiles(@Bind("sessionId") String sessionId);

    @SqlQuery("SELECT COUNT(*) FROM found_files WHERE session_id = :sessionId AND outcome = :outcome")
    long countFoundFilesWithOutcome(@Bind("sessionId") String sessionId, @Bind("outcome") String outcome);

    // --- Flush ---------------------------------------------------------------

    /**
     * One orchestrator flush: queue completions, newly discovered directories, matches and
     * session counters, all-or-nothing. The stored files-found counter includes the matches
     * inserted by this batch; the return value is that number of newly inserted matches.
     */
    @Transaction
    default int commitBatch(String sessionId,
                            List<QueueCompletion> completions,
                            List<String> released,
                            List<String> discovered,
                            List<String> found,
                            SessionCounters counters,
                            long now) {
        if (!completions.isEmpty()) completeEntries(sessionId, completions);
        if (!released.isEmpty()) transitionEntries(sessionId, released, "IN_PROGRESS", "PENDING", null);
        if (!discovered.isEmpty()) enqueue(sessionId, discovered, now);
        int inserted = 0;
        if (!found.isEmpty()) {
            for (int c : insertFoundFiles(sessionId, found, now)) inserted += c;
        }
        updateSessionCounters(sessionId, counters.withFilesFound(counters.filesFound() + inserted), now);
        return inserted;
    }
}
