package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Caches written by the first release kept a single {@code searched_dirs(path, last_searched_at)}
 * table with second precision. Import those rows as completed entries and drop the table.
 */
public final class V2__legacy_searched_dirs extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        if (!tableExists(conn, "searched_dirs")) return;

        try (Statement st = conn.createStatement()) {
            st.execute("""
                INSERT INTO directory_cache (path, last_searched, completed)
                SELECT path, last_searched_at * 1000, 1
                  FROM searched_dirs
                 WHERE path IS NOT NULL
                ON CONFLICT(path) DO NOTHING
                """);
            st.execute("DROP TABLE searched_dirs");
        }
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
