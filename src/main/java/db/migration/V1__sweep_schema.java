package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__sweep_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS directory_cache (
                    path TEXT PRIMARY KEY,
                    last_searched INTEGER NOT NULL,
                    completed INTEGER NOT NULL DEFAULT 0,
                    error TEXT,
                    match_found INTEGER NOT NULL DEFAULT 0,
                    session_id TEXT
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS search_sessions (
                    id TEXT PRIMARY KEY,
                    root TEXT NOT NULL,
                    recursive_scan INTEGER NOT NULL,
                    force_refresh INTEGER NOT NULL,
                    dry_run INTEGER NOT NULL,
                    status TEXT NOT NULL DEFAULT 'ACTIVE',
                    created_at INTEGER NOT NULL,
                    updated_at INTEGER NOT NULL,
                    completed_at INTEGER,
                    dirs_new INTEGER NOT NULL DEFAULT 0,
                    dirs_resumed INTEGER NOT NULL DEFAULT 0,
                    dirs_skipped INTEGER NOT NULL DEFAULT 0,
                    dirs_errored INTEGER NOT NULL DEFAULT 0,
                    files_found INTEGER NOT NULL DEFAULT 0,
                    files_deleted INTEGER NOT NULL DEFAULT 0
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS work_queue (
                    session_id TEXT NOT NULL,
                    path TEXT NOT NULL,
                    state TEXT NOT NULL DEFAULT 'PENDING',
                    enqueued_at INTEGER NOT NULL,
                    error TEXT,
                    PRIMARY KEY (session_id, path),
                    FOREIGN KEY (session_id) REFERENCES search_sessions(id) ON DELETE CASCADE
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS found_files (
                    session_id TEXT NOT NULL,
                    path TEXT NOT NULL,
                    found_at INTEGER NOT NULL,
                    outcome TEXT,
                    error TEXT,
                    PRIMARY KEY (session_id, path),
                    FOREIGN KEY (session_id) REFERENCES search_sessions(id) ON DELETE CASCADE
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            // window queries (fresh index load, prune)
            st.execute("CREATE INDEX IF NOT EXISTS idx_cache_last_searched ON directory_cache(last_searched)");
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_cache_fresh_complete
                    ON directory_cache(last_searched, completed) WHERE completed = 1
                """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_cache_incomplete
                    ON directory_cache(completed) WHERE completed = 0
                """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_session_state ON work_queue(session_id, state, enqueued_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_status ON search_sessions(status, created_at)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_sessions_root ON search_sessions(root, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_found_files_session ON found_files(session_id, outcome)");
        }
    }
}
